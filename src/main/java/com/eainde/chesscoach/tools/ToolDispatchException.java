package com.eainde.chesscoach.tools;

import com.eainde.chesscoach.error.ChessCoachException;

/**
 * A tool call could not be carried out: unknown tool or arguments that do not match the schema.
 * Always reported back to the model as a failed {@link ToolResult}.
 */
public class ToolDispatchException extends ChessCoachException {

    public ToolDispatchException(String message) {
        super(message);
    }
}

package com.eainde.chesscoach.engine;

import com.eainde.chesscoach.error.ChessCoachException;

/**
 * The Engine Oracle could not produce an evaluation: no free handle, the process died,
 * or the search overran its time budget.
 */
public class EngineUnavailableException extends ChessCoachException {

    public EngineUnavailableException(String message) {
        super(message);
    }

    public EngineUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.eainde.chesscoach.agent;

import com.eainde.chesscoach.error.ChessCoachException;

/** The reasoning model could not be reached, even after retrying. */
public class ModelCommunicationException extends ChessCoachException {

    public ModelCommunicationException(String message, Throwable cause) {
        super(message, cause);
    }
}

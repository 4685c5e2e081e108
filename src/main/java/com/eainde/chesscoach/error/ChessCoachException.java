package com.eainde.chesscoach.error;

/**
 * Root of the unchecked exception hierarchy used across lesson generation.
 */
public class ChessCoachException extends RuntimeException {

    public ChessCoachException(String message) {
        super(message);
    }

    public ChessCoachException(String message, Throwable cause) {
        super(message, cause);
    }
}

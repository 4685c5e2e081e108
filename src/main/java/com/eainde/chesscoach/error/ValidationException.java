package com.eainde.chesscoach.error;

/**
 * Malformed input: a FEN, a move, an annotation or a request field.
 * <p>
 * Raised while checking a model's final payload it is turned into corrective feedback;
 * raised from a request it is fatal for that request.
 */
public class ValidationException extends ChessCoachException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}

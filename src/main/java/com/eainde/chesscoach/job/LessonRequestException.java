package com.eainde.chesscoach.job;

import com.eainde.chesscoach.error.ValidationException;

/** A lesson request was rejected before any work was scheduled. */
public class LessonRequestException extends ValidationException {

    public LessonRequestException(String message) {
        super(message);
    }

    public LessonRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}

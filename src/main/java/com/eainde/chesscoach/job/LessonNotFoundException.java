package com.eainde.chesscoach.job;

import com.eainde.chesscoach.error.ChessCoachException;

public class LessonNotFoundException extends ChessCoachException {

    public LessonNotFoundException(String jobId) {
        super("Lesson job '" + jobId + "' not found");
    }
}

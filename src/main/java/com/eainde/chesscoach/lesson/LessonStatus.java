package com.eainde.chesscoach.lesson;

import com.fasterxml.jackson.annotation.JsonValue;

/** Lifecycle of a lesson and of the job generating it. Transitions only leave {@link #GENERATING}. */
public enum LessonStatus {
    GENERATING,
    COMPLETED,
    FAILED;

    @JsonValue
    public String label() {
        return name().toLowerCase();
    }

    public boolean isTerminal() {
        return this != GENERATING;
    }

    public static LessonStatus fromLabel(String label) {
        for (LessonStatus status : values()) {
            if (status.label().equalsIgnoreCase(label)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown lesson status '" + label + "'");
    }
}

package com.eainde.chesscoach.lesson;

import com.eainde.chesscoach.error.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum QuestionType {
    MULTIPLE_CHOICE,
    MOVE_SELECTION,
    TEXT;

    @JsonValue
    public String label() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static QuestionType fromLabel(String label) {
        for (QuestionType type : values()) {
            if (type.label().equalsIgnoreCase(label)) {
                return type;
            }
        }
        throw new ValidationException("Unknown question type '" + label
                + "', expected multiple_choice, move_selection or text");
    }
}

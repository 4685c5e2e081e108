package com.eainde.chesscoach.lesson;

import com.eainde.chesscoach.error.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum AnnotationType {
    ARROW,
    CIRCLE,
    HIGHLIGHT;

    @JsonValue
    public String label() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static AnnotationType fromLabel(String label) {
        for (AnnotationType type : values()) {
            if (type.label().equalsIgnoreCase(label)) {
                return type;
            }
        }
        throw new ValidationException("Unknown annotation type '" + label + "', expected arrow, circle or highlight");
    }
}

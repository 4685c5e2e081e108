package com.eainde.chesscoach.lesson;

import com.eainde.chesscoach.error.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.stream.Collectors;

public enum AnnotationColor {
    RED,
    GREEN,
    BLUE,
    YELLOW,
    ORANGE;

    @JsonValue
    public String label() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static AnnotationColor fromLabel(String label) {
        for (AnnotationColor color : values()) {
            if (color.label().equalsIgnoreCase(label)) {
                return color;
            }
        }
        throw new ValidationException("Unknown annotation color '" + label + "', expected one of "
                + Arrays.stream(values()).map(AnnotationColor::label).collect(Collectors.joining(", ")));
    }
}

package com.eainde.chesscoach.lesson;

import com.eainde.chesscoach.chess.Square;
import com.eainde.chesscoach.error.ValidationException;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;

/**
 * Arrow, circle or highlight drawn on the board next to a lesson step. Arrows use
 * {@code from}/{@code to}; circles and highlights use {@code square}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BoardAnnotation(AnnotationType type, AnnotationColor color, String from, String to, String square) {

    public static BoardAnnotation arrow(AnnotationColor color, String from, String to) {
        return create(AnnotationType.ARROW, color, from, to, null);
    }

    public static BoardAnnotation mark(AnnotationType type, AnnotationColor color, String square) {
        return create(type, color, null, null, square);
    }

    /**
     * Builds an annotation and checks it.
     *
     * @throws ValidationException listing every violated rule
     */
    public static BoardAnnotation create(AnnotationType type, AnnotationColor color, String from, String to, String square) {
        BoardAnnotation annotation = new BoardAnnotation(type, color, from, to, square);
        List<String> problems = annotation.violations();
        if (!problems.isEmpty()) {
            throw new ValidationException(String.join("; ", problems));
        }
        return annotation;
    }

    public List<String> violations() {
        List<String> problems = new ArrayList<>();
        if (type == null) {
            problems.add("annotation type is required");
        }
        if (color == null) {
            problems.add("annotation color is required");
        }
        if (type == AnnotationType.ARROW) {
            checkSquare("from", from, problems);
            checkSquare("to", to, problems);
            if (from != null && from.equals(to)) {
                problems.add("arrow must connect two different squares");
            }
        } else if (type != null) {
            checkSquare("square", square, problems);
        }
        return problems;
    }

    private static void checkSquare(String field, String value, List<String> problems) {
        if (value == null || value.isBlank()) {
            problems.add("'" + field + "' square is required");
        } else if (!Square.isValid(value)) {
            problems.add("'" + value + "' is not a board square (files a-h, ranks 1-8)");
        }
    }
}

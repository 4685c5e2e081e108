package com.eainde.chesscoach.lesson;

import com.eainde.chesscoach.error.ValidationException;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Interactive question attached to a lesson step.
 * <p>
 * Required fields depend on {@link #type()}: every question needs its text; a multiple-choice
 * question also needs a non-empty option list, a correct answer taken from that list and an
 * explanation. Move-selection and free-text questions may carry a correct answer.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Question(
        QuestionType type,
        String question,
        List<String> options,
        @JsonProperty("correct_answer") String correctAnswer,
        String explanation
) {

    public Question {
        options = options == null ? null : List.copyOf(options);
    }

    public static Question create(QuestionType type, String question, List<String> options,
                                  String correctAnswer, String explanation) {
        Question created = new Question(type, question, options, correctAnswer, explanation);
        List<String> problems = created.violations();
        if (!problems.isEmpty()) {
            throw new ValidationException(String.join("; ", problems));
        }
        return created;
    }

    @JsonIgnore
    public List<String> violations() {
        List<String> problems = new ArrayList<>();
        if (type == null) {
            problems.add("question type is required");
            return problems;
        }
        if (isBlank(question)) {
            problems.add("question text is required");
        }
        switch (type) {
            case MULTIPLE_CHOICE -> {
                if (options == null || options.isEmpty()) {
                    problems.add("multiple_choice question needs a non-empty options list");
                } else if (correctAnswer == null || !options.contains(correctAnswer)) {
                    problems.add("multiple_choice correct_answer '" + correctAnswer + "' must be one of the options " + options);
                }
                if (isBlank(explanation)) {
                    problems.add("multiple_choice question needs an explanation");
                }
            }
            case MOVE_SELECTION, TEXT -> {
                // text only
            }
        }
        return problems;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}

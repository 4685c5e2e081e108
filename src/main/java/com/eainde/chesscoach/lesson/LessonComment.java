package com.eainde.chesscoach.lesson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One explained position of a lesson.
 *
 * @param stepNumber  1-based position in the lesson
 * @param positionFen position shown on the board
 * @param moveToMake  optional demonstration move, legal from {@code positionFen}
 * @param question    optional interactive question
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LessonComment(
        @JsonProperty("step_number") int stepNumber,
        @JsonProperty("position_fen") String positionFen,
        String text,
        List<BoardAnnotation> annotations,
        @JsonProperty("move_to_make") String moveToMake,
        Question question
) {

    public LessonComment {
        annotations = annotations == null ? List.of() : List.copyOf(annotations);
    }
}

package com.eainde.chesscoach.lesson;

import com.eainde.chesscoach.error.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BoardAnnotationTest {

    @Test
    void arrow_shouldNeedTwoDifferentSquares() {
        assertThat(BoardAnnotation.arrow(AnnotationColor.GREEN, "e2", "e4").violations()).isEmpty();
        assertThatThrownBy(() -> BoardAnnotation.arrow(AnnotationColor.GREEN, "e4", "e4"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("two different squares");
        assertThatThrownBy(() -> BoardAnnotation.arrow(AnnotationColor.GREEN, "e2", null))
                .hasMessageContaining("'to' square is required");
    }

    @Test
    void mark_shouldNeedASquare() {
        assertThat(BoardAnnotation.mark(AnnotationType.HIGHLIGHT, AnnotationColor.YELLOW, "h8").square()).isEqualTo("h8");
        assertThatThrownBy(() -> BoardAnnotation.mark(AnnotationType.CIRCLE, AnnotationColor.RED, null))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void violations_shouldListEveryProblem() {
        List<String> problems = new BoardAnnotation(AnnotationType.ARROW, null, "z9", null, null).violations();

        assertThat(problems).hasSize(3);
    }

    @Test
    void question_shouldOnlyRequireTextOutsideMultipleChoice() {
        assertThat(new Question(QuestionType.TEXT, "Why?", null, null, null).violations()).isEmpty();
        assertThat(new Question(QuestionType.TEXT, "", null, null, null).violations())
                .containsExactly("question text is required");
        assertThat(new Question(QuestionType.MULTIPLE_CHOICE, "Which?", List.of(), null, "because").violations())
                .containsExactly("multiple_choice question needs a non-empty options list");
    }
}

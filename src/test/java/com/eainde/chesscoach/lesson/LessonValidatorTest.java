package com.eainde.chesscoach.lesson;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.eainde.chesscoach.lesson.LessonFixtures.AFTER_E4;
import static com.eainde.chesscoach.lesson.LessonFixtures.START;
import static org.assertj.core.api.Assertions.assertThat;

class LessonValidatorTest {

    private static List<LessonComment> withStep(int index, LessonComment replacement) {
        List<LessonComment> comments = new ArrayList<>(LessonFixtures.validComments());
        comments.set(index, replacement);
        return comments;
    }

    // ===== Whole lesson =====

    @Nested
    @DisplayName("lesson shape")
    class Shape {

        @Test
        @DisplayName("should accept a valid lesson, every time")
        void validIsIdempotent() {
            List<LessonComment> comments = LessonFixtures.validComments();

            assertThat(LessonValidator.validate(comments)).isEmpty();
            assertThat(LessonValidator.validate(comments)).isEmpty();
        }

        @Test
        @DisplayName("should reject fewer than three comments")
        void tooFew() {
            List<String> problems = LessonValidator.validate(LessonFixtures.validComments().subList(0, 2));

            assertThat(problems).containsExactly("lesson must have between 3 and 5 comments, got 2");
        }

        @Test
        @DisplayName("should reject more than five comments")
        void tooMany() {
            List<LessonComment> comments = new ArrayList<>();
            for (int i = 1; i <= 6; i++) {
                comments.add(new LessonComment(i, START, "Step " + i, null, null, null));
            }

            assertThat(LessonValidator.validate(comments)).containsExactly("lesson must have between 3 and 5 comments, got 6");
        }

        @Test
        @DisplayName("should reject step numbers that skip")
        void nonContiguous() {
            List<String> problems = LessonValidator.validate(
                    withStep(2, new LessonComment(4, START, "Skipped a number.", null, null, null)));

            assertThat(problems).containsExactly("step 3: step_number is 4, expected 3");
        }
    }

    // ===== Single step =====

    @Nested
    @DisplayName("step contents")
    class Steps {

        @Test
        @DisplayName("should report an unreadable FEN")
        void badFen() {
            List<String> problems = LessonValidator.validate(
                    withStep(0, new LessonComment(1, "8/8/8/8 w - -", "Broken.", null, null, null)));

            assertThat(problems).hasSize(1);
            assertThat(problems.get(0)).startsWith("step 1: ");
        }

        @Test
        @DisplayName("should report a demonstration move that is not legal")
        void illegalMoveToMake() {
            List<String> problems = LessonValidator.validate(
                    withStep(1, new LessonComment(2, AFTER_E4, "Black moves.", null, "e2e4", null)));

            assertThat(problems).singleElement().asString().startsWith("step 2: move_to_make");
        }

        @Test
        @DisplayName("should require text")
        void missingText() {
            assertThat(LessonValidator.validate(withStep(0, new LessonComment(1, START, " ", null, null, null))))
                    .containsExactly("step 1: text is required");
        }

        @Test
        @DisplayName("should report annotations off the board")
        void badAnnotation() {
            BoardAnnotation offBoard = new BoardAnnotation(AnnotationType.HIGHLIGHT, AnnotationColor.RED, null, null, "i9");

            List<String> problems = LessonValidator.validate(
                    withStep(0, new LessonComment(1, START, "Look here.", List.of(offBoard), null, null)));

            assertThat(problems).singleElement().asString()
                    .startsWith("step 1, annotation 1: ")
                    .contains("'i9' is not a board square");
        }

        @Test
        @DisplayName("should report every broken question rule at once")
        void badMultipleChoice() {
            Question question = new Question(QuestionType.MULTIPLE_CHOICE, "Pick one", List.of("a", "b"), "c", null);

            List<String> problems = LessonValidator.validate(
                    withStep(0, new LessonComment(1, START, "Quiz.", null, null, question)));

            assertThat(problems).hasSize(2).allMatch(p -> p.startsWith("step 1: multiple_choice"));
        }

        @Test
        @DisplayName("should report a move-selection answer that is not legal")
        void illegalMoveSelection() {
            Question question = new Question(QuestionType.MOVE_SELECTION, "Best move?", null, "Qh5", null);

            List<String> problems = LessonValidator.validate(
                    withStep(0, new LessonComment(1, START, "Find it.", null, null, question)));

            assertThat(problems).singleElement().asString().startsWith("step 1: move_selection correct_answer");
        }
    }
}

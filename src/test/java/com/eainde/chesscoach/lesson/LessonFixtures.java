package com.eainde.chesscoach.lesson;

import java.util.List;

/**
 * Lessons shared by tests that need a payload the validator accepts.
 */
public final class LessonFixtures {

    public static final String START = "rnbqkbnr/pppppppp/8/8/8/8/PPPPPPPP/RNBQKBNR w KQkq - 0 1";
    public static final String AFTER_E4 = "rnbqkbnr/pppppppp/8/8/4P3/8/PPPP1PPP/RNBQKBNR b KQkq e3 0 1";
    public static final String AFTER_E5 = "rnbqkbnr/pppp1ppp/8/4p3/4P3/8/PPPP1PPP/RNBQKBNR w KQkq e6 0 2";

    private LessonFixtures() {
    }

    public static List<LessonComment> validComments() {
        return List.of(
                new LessonComment(1, START, "Start by claiming the center.",
                        List.of(BoardAnnotation.arrow(AnnotationColor.GREEN, "e2", "e4")), "e2e4", null),
                new LessonComment(2, AFTER_E4, "Black answers symmetrically.",
                        List.of(BoardAnnotation.mark(AnnotationType.CIRCLE, AnnotationColor.BLUE, "e5")), "e7e5",
                        Question.create(QuestionType.MULTIPLE_CHOICE, "Which square does e4 control?",
                                List.of("d5", "e5"), "d5", "Pawns capture diagonally.")),
                new LessonComment(3, AFTER_E5, "Now develop a knight toward the center.",
                        List.of(), "g1f3",
                        Question.create(QuestionType.MOVE_SELECTION, "Find the developing move that attacks e5.",
                                null, "Nf3", null)));
    }

    /** The same lesson as the model would send it. */
    public static String validCommentsJson() {
        return """
                {"comments": [
                  {"step_number": 1, "position_fen": "%s", "text": "Start by claiming the center.",
                   "annotations": [{"type": "arrow", "color": "green", "from": "e2", "to": "e4"}],
                   "move_to_make": "e2e4"},
                  {"step_number": 2, "position_fen": "%s", "text": "Black answers symmetrically.",
                   "annotations": [{"type": "circle", "color": "blue", "square": "e5"}],
                   "move_to_make": "e7e5",
                   "question": {"type": "multiple_choice", "question": "Which square does e4 control?",
                                "options": ["d5", "e5"], "correct_answer": "d5",
                                "explanation": "Pawns capture diagonally."}},
                  {"step_number": 3, "position_fen": "%s", "text": "Now develop a knight toward the center.",
                   "move_to_make": "g1f3",
                   "question": {"type": "move_selection", "question": "Find the developing move that attacks e5.",
                                "correct_answer": "Nf3"}}
                ]}
                """.formatted(START, AFTER_E4, AFTER_E5);
    }

    /** Two steps only; one short of a lesson. */
    public static String twoCommentJson() {
        return """
                {"comments": [
                  {"step_number": 1, "position_fen": "%s", "text": "Claim the center.", "move_to_make": "e2e4"},
                  {"step_number": 2, "position_fen": "%s", "text": "Black mirrors."}
                ]}
                """.formatted(START, AFTER_E4);
    }
}

package com.eainde.chesscoach.lesson;

import com.eainde.chesscoach.chess.Board;
import com.eainde.chesscoach.error.ValidationException;

import java.util.ArrayList;
import java.util.List;

/**
 * Checks a lesson against every rule the rendering side relies on and returns all violations at
 * once, so a model can repair its answer in a single round. Pure; checking a valid lesson again
 * yields no violations.
 */
public final class LessonValidator {

    private LessonValidator() {
    }

    public static List<String> validate(List<LessonComment> comments) {
        List<String> problems = new ArrayList<>();
        if (comments == null) {
            problems.add("lesson has no comments");
            return problems;
        }
        if (comments.size() < Lesson.MIN_COMMENTS || comments.size() > Lesson.MAX_COMMENTS) {
            problems.add("lesson must have between " + Lesson.MIN_COMMENTS + " and " + Lesson.MAX_COMMENTS
                    + " comments, got " + comments.size());
        }
        for (int i = 0; i < comments.size(); i++) {
            LessonComment comment = comments.get(i);
            String step = "step " + (i + 1);
            if (comment == null) {
                problems.add(step + ": comment is null");
                continue;
            }
            if (comment.stepNumber() != i + 1) {
                problems.add(step + ": step_number is " + comment.stepNumber() + ", expected " + (i + 1));
            }
            if (comment.text() == null || comment.text().isBlank()) {
                problems.add(step + ": text is required");
            }
            Board board = checkPosition(step, comment, problems);
            checkAnnotations(step, comment, problems);
            if (comment.question() != null) {
                comment.question().violations().forEach(p -> problems.add(step + ": " + p));
                checkMoveSelectionAnswer(step, board, comment.question(), problems);
            }
        }
        return problems;
    }

    private static Board checkPosition(String step, LessonComment comment, List<String> problems) {
        if (comment.positionFen() == null || comment.positionFen().isBlank()) {
            problems.add(step + ": position_fen is required");
            return null;
        }
        Board board;
        try {
            board = Board.fromFen(comment.positionFen());
        } catch (ValidationException e) {
            problems.add(step + ": " + e.getMessage());
            return null;
        }
        if (comment.moveToMake() != null && !comment.moveToMake().isBlank()) {
            try {
                board.parseMove(comment.moveToMake());
            } catch (ValidationException e) {
                problems.add(step + ": move_to_make " + e.getMessage());
            }
        }
        return board;
    }

    private static void checkAnnotations(String step, LessonComment comment, List<String> problems) {
        for (int a = 0; a < comment.annotations().size(); a++) {
            BoardAnnotation annotation = comment.annotations().get(a);
            String where = step + ", annotation " + (a + 1) + ": ";
            annotation.violations().forEach(p -> problems.add(where + p));
        }
    }

    private static void checkMoveSelectionAnswer(String step, Board board, Question question, List<String> problems) {
        if (board == null || question.type() != QuestionType.MOVE_SELECTION) {
            return;
        }
        String answer = question.correctAnswer();
        if (answer == null || answer.isBlank()) {
            return;
        }
        try {
            board.parseMove(answer);
        } catch (ValidationException e) {
            problems.add(step + ": move_selection correct_answer " + e.getMessage());
        }
    }
}

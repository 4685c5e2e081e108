package com.eainde.chesscoach.lesson;

import java.util.List;

/**
 * A generated lesson: three to five explained positions in order.
 */
public record Lesson(String id, List<LessonComment> comments, LessonStatus status) {

    public static final int MIN_COMMENTS = 3;
    public static final int MAX_COMMENTS = 5;

    public Lesson {
        comments = comments == null ? List.of() : List.copyOf(comments);
    }
}

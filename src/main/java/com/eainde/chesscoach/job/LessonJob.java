package com.eainde.chesscoach.job;

import com.eainde.chesscoach.lesson.Lesson;
import com.eainde.chesscoach.lesson.LessonStatus;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/**
 * Immutable snapshot of a lesson generation job. {@code result} is present iff the job
 * completed, {@code errorMessage} iff it failed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LessonJob(
        String jobId,
        LessonStatus status,
        Lesson result,
        String errorMessage,
        String title,
        String gameId,
        int userElo,
        List<String> focusAreas,
        Instant createdAt,
        Instant completedAt
) {

    public LessonJob {
        focusAreas = focusAreas == null ? List.of() : List.copyOf(focusAreas);
        if ((status == LessonStatus.COMPLETED) != (result != null)) {
            throw new IllegalArgumentException("result must be present iff the job is completed");
        }
        if ((status == LessonStatus.FAILED) != (errorMessage != null && !errorMessage.isBlank())) {
            throw new IllegalArgumentException("errorMessage must be present iff the job failed");
        }
        if (status.isTerminal() != (completedAt != null)) {
            throw new IllegalArgumentException("completedAt must be present iff the job is terminal");
        }
    }

    public static LessonJob generating(String jobId, String title, String gameId, int userElo,
                                       List<String> focusAreas, Instant createdAt) {
        return new LessonJob(jobId, LessonStatus.GENERATING, null, null, title, gameId, userElo, focusAreas, createdAt, null);
    }

    public LessonJob complete(Lesson lesson, Instant at) {
        requireGenerating(LessonStatus.COMPLETED);
        return new LessonJob(jobId, LessonStatus.COMPLETED, lesson, null, title, gameId, userElo, focusAreas, createdAt, at);
    }

    public LessonJob fail(String message, Instant at) {
        requireGenerating(LessonStatus.FAILED);
        return new LessonJob(jobId, LessonStatus.FAILED, null, message, title, gameId, userElo, focusAreas, createdAt, at);
    }

    private void requireGenerating(LessonStatus target) {
        if (status != LessonStatus.GENERATING) {
            throw new IllegalStateException("Job " + jobId + " is already " + status.label() + ", cannot move to " + target.label());
        }
    }
}

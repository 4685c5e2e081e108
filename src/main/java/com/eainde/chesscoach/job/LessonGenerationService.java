package com.eainde.chesscoach.job;

import com.eainde.chesscoach.agent.CoachAgent;
import com.eainde.chesscoach.agent.CoachRequest;
import com.eainde.chesscoach.chess.GameRecord;
import com.eainde.chesscoach.chess.PgnParser;
import com.eainde.chesscoach.config.JobProperties;
import com.eainde.chesscoach.error.ValidationException;
import com.eainde.chesscoach.lesson.Lesson;
import com.eainde.chesscoach.lesson.LessonStatus;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Creates lesson jobs and runs the coach loop for each one in the background.
 * <p>
 * {@link #create} validates the request, stores a {@code generating} job and returns at once.
 * The background task is the only writer of that job's terminal status. Deleting a job makes
 * the loop stop at its next iteration; whatever the task produces afterwards is discarded.
 */
@Slf4j
@Service
public class LessonGenerationService {

    static final String MDC_JOB_ID = "jobId";

    private final LessonJobStore store;
    private final CoachAgent coachAgent;
    private final Executor executor;
    private final JobProperties properties;
    private final Clock clock;

    public LessonGenerationService(LessonJobStore store,
                                   CoachAgent coachAgent,
                                   @Qualifier("lessonExecutor") Executor executor,
                                   JobProperties properties,
                                   Clock clock) {
        this.store = store;
        this.coachAgent = coachAgent;
        this.executor = executor;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * @return the new job, still {@code generating}
     * @throws LessonRequestException if the game does not replay or the rating is out of range
     */
    public LessonJob create(LessonRequest request) {
        if (request == null || request.pgn() == null || request.pgn().isBlank()) {
            throw new LessonRequestException("pgn is required");
        }
        int userElo = request.userElo() != null ? request.userElo() : properties.defaultElo();
        if (userElo < LessonRequest.MIN_ELO || userElo > LessonRequest.MAX_ELO) {
            throw new LessonRequestException("userElo must be between " + LessonRequest.MIN_ELO
                    + " and " + LessonRequest.MAX_ELO + ", got " + userElo);
        }
        GameRecord game;
        try {
            game = PgnParser.parse(request.pgn());
        } catch (ValidationException e) {
            throw new LessonRequestException("Invalid game: " + e.getMessage(), e);
        }

        String jobId = UUID.randomUUID().toString();
        LessonJob job = LessonJob.generating(jobId, request.title(), request.gameId(), userElo,
                request.focusAreas(), clock.instant());
        store.insertGenerating(job);

        CoachRequest coachRequest = new CoachRequest(jobId, game, userElo, request.focusAreas());
        MDC.put(MDC_JOB_ID, jobId);
        try {
            log.info("Lesson job created: {} moves, elo {}, focus {}", game.moveCount(), userElo, request.focusAreas());
            executor.execute(() -> generate(coachRequest));
        } catch (RejectedExecutionException e) {
            log.error("Lesson job could not be scheduled", e);
            store.markFailed(jobId, "Lesson generation could not be scheduled: server is busy", clock.instant());
        } finally {
            MDC.remove(MDC_JOB_ID);
        }
        return job;
    }

    /** Current snapshot; repeated calls on a terminal job return equal snapshots. */
    public LessonJob getStatus(String jobId) {
        return store.find(jobId).orElseThrow(() -> new LessonNotFoundException(jobId));
    }

    /** Newest first; {@code status} may be {@code null} for all jobs. */
    public List<LessonJob> list(LessonStatus status) {
        return store.findAll().stream()
                .filter(job -> status == null || job.status() == status)
                .sorted(Comparator.comparing(LessonJob::createdAt).reversed())
                .toList();
    }

    public void delete(String jobId) {
        LessonJob removed = store.remove(jobId).orElseThrow(() -> new LessonNotFoundException(jobId));
        log.info("Lesson job {} deleted while {}", jobId, removed.status().label());
    }

    void generate(CoachRequest request) {
        String jobId = request.lessonId();
        try {
            Lesson lesson = coachAgent.generate(request, () -> !store.contains(jobId));
            store.markCompleted(jobId, lesson, clock.instant()).ifPresentOrElse(
                    job -> log.info("Lesson job completed with {} steps", lesson.comments().size()),
                    () -> log.info("Lesson job was deleted, discarding finished lesson"));
        } catch (CancellationException e) {
            log.info("Lesson job stopped after deletion");
        } catch (RuntimeException e) {
            fail(jobId, e);
        } catch (Error e) {
            // the job must still reach a terminal state before the worker thread sees the error
            fail(jobId, e);
            throw e;
        }
    }

    private void fail(String jobId, Throwable e) {
        String message = describe(e);
        log.error("Lesson job failed: {}", message, e);
        if (store.markFailed(jobId, message, clock.instant()).isEmpty()) {
            log.info("Lesson job was deleted, discarding failure");
        }
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? "Lesson generation failed: " + e.getClass().getSimpleName() : message;
    }
}

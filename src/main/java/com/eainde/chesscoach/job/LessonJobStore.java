package com.eainde.chesscoach.job;

import com.eainde.chesscoach.lesson.Lesson;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory job table. Each entry is an immutable {@link LessonJob} replaced atomically, so
 * readers never block and never see a half-written status/result pair. Only the job's own
 * background task calls {@link #markCompleted} or {@link #markFailed}.
 */
@Component
public class LessonJobStore {

    private final Map<String, LessonJob> jobs = new ConcurrentHashMap<>();

    public void insertGenerating(LessonJob job) {
        if (jobs.putIfAbsent(job.jobId(), job) != null) {
            throw new IllegalStateException("Job " + job.jobId() + " already exists");
        }
    }

    /** @return the completed snapshot, or empty if the job was deleted meanwhile */
    public Optional<LessonJob> markCompleted(String jobId, Lesson lesson, Instant at) {
        return Optional.ofNullable(jobs.computeIfPresent(jobId, (id, job) -> job.complete(lesson, at)));
    }

    /** @return the failed snapshot, or empty if the job was deleted meanwhile */
    public Optional<LessonJob> markFailed(String jobId, String message, Instant at) {
        return Optional.ofNullable(jobs.computeIfPresent(jobId, (id, job) -> job.fail(message, at)));
    }

    public Optional<LessonJob> find(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    public boolean contains(String jobId) {
        return jobs.containsKey(jobId);
    }

    public Optional<LessonJob> remove(String jobId) {
        return Optional.ofNullable(jobs.remove(jobId));
    }

    public List<LessonJob> findAll() {
        Collection<LessonJob> snapshot = jobs.values();
        return List.copyOf(snapshot);
    }
}

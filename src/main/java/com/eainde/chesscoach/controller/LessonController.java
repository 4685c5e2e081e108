package com.eainde.chesscoach.controller;

import com.eainde.chesscoach.job.LessonGenerationService;
import com.eainde.chesscoach.job.LessonJob;
import com.eainde.chesscoach.job.LessonRequest;
import com.eainde.chesscoach.job.LessonRequestException;
import com.eainde.chesscoach.lesson.LessonStatus;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/lessons")
@RequiredArgsConstructor
public class LessonController {

    private final LessonGenerationService lessonService;

    @PostMapping
    @ResponseStatus(HttpStatus.ACCEPTED)
    public LessonCreated createLesson(@RequestBody LessonRequest request) {
        LessonJob job = lessonService.create(request);
        return new LessonCreated(job.jobId(), job.status());
    }

    @GetMapping("/{jobId}")
    public LessonJob getLesson(@PathVariable String jobId) {
        return lessonService.getStatus(jobId);
    }

    @GetMapping
    public List<LessonJob> listLessons(@RequestParam(name = "status", required = false) String status) {
        return lessonService.list(parseStatus(status));
    }

    @DeleteMapping("/{jobId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteLesson(@PathVariable String jobId) {
        lessonService.delete(jobId);
    }

    private static LessonStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return LessonStatus.fromLabel(status);
        } catch (IllegalArgumentException e) {
            throw new LessonRequestException(e.getMessage() + "; expected generating, completed or failed");
        }
    }

    public record LessonCreated(String jobId, LessonStatus status) {
    }
}

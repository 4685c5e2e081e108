package com.eainde.chesscoach.controller;

import com.eainde.chesscoach.error.ChessCoachException;
import com.eainde.chesscoach.error.ValidationException;
import com.eainde.chesscoach.job.LessonNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps exceptions from the lesson API to status codes with an {@code {"error": ...}} body. */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(LessonNotFoundException.class)
    public ResponseEntity<ErrorBody> notFound(LessonNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(new ErrorBody(e.getMessage()));
    }

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorBody> badRequest(ValidationException e) {
        log.debug("Rejected lesson request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(new ErrorBody(e.getMessage()));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorBody> unreadable(HttpMessageNotReadableException e) {
        return ResponseEntity.badRequest().body(new ErrorBody("Request body is not valid JSON"));
    }

    @ExceptionHandler(ChessCoachException.class)
    public ResponseEntity<ErrorBody> serverError(ChessCoachException e) {
        log.error("Lesson API failure", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(new ErrorBody(e.getMessage()));
    }

    public record ErrorBody(String error) {
    }
}

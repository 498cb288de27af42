package com.scholary.podcast.api;

import com.scholary.podcast.error.PodcastException;
import com.scholary.podcast.job.InvalidConfigException;
import com.scholary.podcast.job.JobNotFoundException;
import com.scholary.podcast.job.JobStateConflictException;
import com.scholary.podcast.transcript.TranscriptBufferException;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.UUID;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Converts exceptions to HTTP responses with an {@link ApiError} body.
 *
 * <p>Unknown job 404, invalid request 400, operation not allowed in the job's state 409,
 * anything else 500. Every response carries an error id that is also logged.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(JobNotFoundException.class)
  public ResponseEntity<ApiError> handleJobNotFound(
      JobNotFoundException ex, HttpServletRequest request) {
    String errorId = generateErrorId();
    LOGGER.warn("[{}] {}", errorId, ex.getMessage());
    return respond(HttpStatus.NOT_FOUND, errorId, ApiError.JOB_NOT_FOUND, null, ex, request);
  }

  @ExceptionHandler(JobStateConflictException.class)
  public ResponseEntity<ApiError> handleStateConflict(
      JobStateConflictException ex, HttpServletRequest request) {
    String errorId = generateErrorId();
    LOGGER.warn("[{}] {}", errorId, ex.getMessage());
    return respond(HttpStatus.CONFLICT, errorId, ApiError.JOB_STATE_CONFLICT, null, ex, request);
  }

  @ExceptionHandler(InvalidConfigException.class)
  public ResponseEntity<ApiError> handleInvalidConfig(
      InvalidConfigException ex, HttpServletRequest request) {
    String errorId = generateErrorId();
    LOGGER.warn("[{}] Invalid job config: {}", errorId, ex.getMessage());
    return respond(
        HttpStatus.BAD_REQUEST, errorId, ApiError.INVALID_CONFIG, ex.kind().name(), ex, request);
  }

  @ExceptionHandler(TranscriptBufferException.class)
  public ResponseEntity<ApiError> handleInvalidTranscript(
      TranscriptBufferException ex, HttpServletRequest request) {
    String errorId = generateErrorId();
    LOGGER.warn("[{}] Invalid transcript: {}", errorId, ex.getMessage());
    return respond(
        HttpStatus.BAD_REQUEST,
        errorId,
        ApiError.INVALID_TRANSCRIPT,
        ex.kind().name(),
        ex,
        request);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiError> handleValidation(
      MethodArgumentNotValidException ex, HttpServletRequest request) {
    String errorId = generateErrorId();
    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
    LOGGER.warn("[{}] Validation failed: {}", errorId, message);
    return ResponseEntity.badRequest()
        .body(
            new ApiError(
                errorId,
                ApiError.VALIDATION_ERROR,
                null,
                "Validation failed: " + message,
                request.getRequestURI(),
                Instant.now()));
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiError> handleUnreadable(
      HttpMessageNotReadableException ex, HttpServletRequest request) {
    String errorId = generateErrorId();
    LOGGER.warn("[{}] Unreadable request body: {}", errorId, ex.getMessage());
    return ResponseEntity.badRequest()
        .body(
            new ApiError(
                errorId,
                ApiError.VALIDATION_ERROR,
                null,
                "Malformed request body",
                request.getRequestURI(),
                Instant.now()));
  }

  @ExceptionHandler(PodcastException.class)
  public ResponseEntity<ApiError> handlePodcastException(
      PodcastException ex, HttpServletRequest request) {
    String errorId = generateErrorId();
    LOGGER.error("[{}] Pipeline error {}: {}", errorId, ex.kind(), ex.getMessage(), ex);
    return respond(
        HttpStatus.INTERNAL_SERVER_ERROR,
        errorId,
        ApiError.INTERNAL_ERROR,
        ex.kind().name(),
        ex,
        request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiError> handleUnexpected(Exception ex, HttpServletRequest request) {
    String errorId = generateErrorId();
    LOGGER.error("[{}] Unexpected error", errorId, ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(
            new ApiError(
                errorId,
                ApiError.INTERNAL_ERROR,
                null,
                "An unexpected error occurred. Reference: " + errorId,
                request.getRequestURI(),
                Instant.now()));
  }

  private static ResponseEntity<ApiError> respond(
      HttpStatus status,
      String errorId,
      String code,
      String kind,
      Exception ex,
      HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(
            new ApiError(
                errorId, code, kind, ex.getMessage(), request.getRequestURI(), Instant.now()));
  }

  private static String generateErrorId() {
    return UUID.randomUUID().toString().substring(0, 8);
  }
}

package com.scholary.podcast.job;

import com.scholary.podcast.error.ErrorKind;
import java.time.Instant;

/**
 * One problem recorded against a job.
 *
 * @param timestamp when it happened
 * @param stage the job state at the time
 * @param severity whether the job carried on
 * @param kind error category
 * @param message human-readable detail
 * @param keySegmentId the affected key segment, or null
 */
public record ErrorLogEntry(
    Instant timestamp,
    JobState stage,
    Severity severity,
    ErrorKind kind,
    String message,
    String keySegmentId) {

  public enum Severity {
    /** The job continued, possibly degraded. */
    WARNING,
    /** The job failed. */
    ERROR
  }
}

package com.scholary.podcast.api;

import java.time.Instant;

/**
 * Structured API error response.
 *
 * @param errorId short random id, also written to the log for correlation
 * @param code machine-readable error code
 * @param kind pipeline error kind, when the error came from the pipeline
 * @param message user-facing message
 * @param path request path that caused the error
 * @param timestamp when the error happened
 */
public record ApiError(
    String errorId, String code, String kind, String message, String path, Instant timestamp) {

  public static final String JOB_NOT_FOUND = "JOB_001";
  public static final String JOB_STATE_CONFLICT = "JOB_002";
  public static final String INVALID_CONFIG = "CONFIG_001";
  public static final String INVALID_TRANSCRIPT = "TRANSCRIPT_001";
  public static final String VALIDATION_ERROR = "VALIDATION_001";
  public static final String INTERNAL_ERROR = "INTERNAL_001";
}

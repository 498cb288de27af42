package com.scholary.podcast.error;

/**
 * Base exception for every failure the podcast pipeline reports.
 *
 * <p>Carries an {@link ErrorKind} so the orchestrator can record the failing stage and kind
 * verbatim without inspecting exception types.
 */
public class PodcastException extends RuntimeException {

  private final ErrorKind kind;

  public PodcastException(ErrorKind kind, String message) {
    super(message);
    this.kind = kind;
  }

  public PodcastException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
  }

  public ErrorKind kind() {
    return kind;
  }
}

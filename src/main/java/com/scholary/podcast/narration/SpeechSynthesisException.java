package com.scholary.podcast.narration;

/** Failure of a single speech synthesis call. */
public class SpeechSynthesisException extends RuntimeException {

  /** How the caller should react to the failure. */
  public enum Reason {
    /** Timeout, rate limit or server error; worth retrying. */
    TRANSIENT,
    /** Bad input or authentication; retrying cannot help. */
    PERMANENT,
    /** The vendor does not know the requested voice. */
    INVALID_VOICE
  }

  private final Reason reason;

  public SpeechSynthesisException(Reason reason, String message) {
    super(message);
    this.reason = reason;
  }

  public SpeechSynthesisException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }

  public boolean isTransient() {
    return reason == Reason.TRANSIENT;
  }
}

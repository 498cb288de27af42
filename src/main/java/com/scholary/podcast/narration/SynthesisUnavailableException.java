package com.scholary.podcast.narration;

import com.scholary.podcast.error.ErrorKind;
import com.scholary.podcast.error.PodcastException;

/** Narration could not be produced within the retry budget, or failed permanently. */
public class SynthesisUnavailableException extends PodcastException {

  private final int attempts;

  public SynthesisUnavailableException(String message, int attempts, Throwable cause) {
    super(ErrorKind.SYNTHESIS_UNAVAILABLE, message, cause);
    this.attempts = attempts;
  }

  public int attempts() {
    return attempts;
  }
}

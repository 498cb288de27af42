package com.scholary.podcast.narration;

import com.scholary.podcast.error.ErrorKind;
import com.scholary.podcast.error.PodcastException;

/** The synthesizer rejected the requested voice. Never retried. */
public class InvalidVoiceException extends PodcastException {

  public InvalidVoiceException(String message, Throwable cause) {
    super(ErrorKind.INVALID_VOICE, message, cause);
  }
}

package com.scholary.podcast.whisper;

import com.scholary.podcast.error.ErrorKind;
import com.scholary.podcast.error.PodcastException;

/**
 * Exception thrown when Whisper API calls fail.
 *
 * <p>This could be due to network issues, service unavailability, or invalid responses.
 */
public class WhisperException extends PodcastException {

  public WhisperException(String message) {
    super(ErrorKind.TRANSCRIPTION_FAILED, message);
  }

  public WhisperException(String message, Throwable cause) {
    super(ErrorKind.TRANSCRIPTION_FAILED, message, cause);
  }
}

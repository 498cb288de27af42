package com.scholary.podcast.capture;

import com.scholary.podcast.error.ErrorKind;
import com.scholary.podcast.error.PodcastException;

/** The recording source went away before any usable audio was captured. */
public class RecordingDisconnectedException extends PodcastException {

  public RecordingDisconnectedException(String message) {
    super(ErrorKind.RECORDING_DISCONNECTED, message);
  }

  public RecordingDisconnectedException(String message, Throwable cause) {
    super(ErrorKind.RECORDING_DISCONNECTED, message, cause);
  }
}

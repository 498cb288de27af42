package com.scholary.podcast.transcript;

import com.scholary.podcast.error.ErrorKind;
import com.scholary.podcast.error.PodcastException;

/** Thrown when a chunk is rejected by a {@link TranscriptBuffer}. */
public class TranscriptBufferException extends PodcastException {

  public TranscriptBufferException(ErrorKind kind, String message) {
    super(kind, message);
  }
}

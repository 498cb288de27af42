package com.scholary.podcast.selection;

import com.scholary.podcast.error.ErrorKind;
import com.scholary.podcast.error.PodcastException;

/** Thrown when a content scorer is disabled, unreachable or answers with garbage. */
public class ContentScorerException extends PodcastException {

  public ContentScorerException(String message) {
    super(ErrorKind.SCORER_UNAVAILABLE, message);
  }

  public ContentScorerException(String message, Throwable cause) {
    super(ErrorKind.SCORER_UNAVAILABLE, message, cause);
  }
}

package com.scholary.podcast.assembly;

import com.scholary.podcast.error.ErrorKind;
import com.scholary.podcast.error.PodcastException;

/** There is nothing to assemble. */
public class EmptyTimelineException extends PodcastException {

  public EmptyTimelineException(String message) {
    super(ErrorKind.EMPTY_TIMELINE, message);
  }
}

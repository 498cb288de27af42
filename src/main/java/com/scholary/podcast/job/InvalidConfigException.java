package com.scholary.podcast.job;

import com.scholary.podcast.error.ErrorKind;
import com.scholary.podcast.error.PodcastException;

/** Thrown when a job request carries an unknown voice, style or an out-of-range value. */
public class InvalidConfigException extends PodcastException {

  public InvalidConfigException(String message) {
    super(ErrorKind.INVALID_CONFIG, message);
  }
}

package com.scholary.podcast.storage;

import com.scholary.podcast.error.ErrorKind;
import com.scholary.podcast.error.PodcastException;

/** Thrown when a finished podcast cannot be written to storage. */
public class StorageFailedException extends PodcastException {

  public StorageFailedException(String message, Throwable cause) {
    super(ErrorKind.STORAGE_FAILED, message, cause);
  }
}

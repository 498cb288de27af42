package com.scholary.podcast.objectstore;

/**
 * Exception thrown when object storage operations fail.
 *
 * <p>Callers translate it into the pipeline's own error kinds: an unreadable upload is an asset
 * error, a failed podcast upload is a storage error.
 */
public class ObjectStoreException extends RuntimeException {

  public ObjectStoreException(String message) {
    super(message);
  }

  public ObjectStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}

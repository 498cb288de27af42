package com.scholary.podcast.assembly;

import com.scholary.podcast.error.ErrorKind;
import com.scholary.podcast.error.PodcastException;

/** A referenced audio asset is missing, undecodable or too short for its excerpt. */
public class AssetUnreadableException extends PodcastException {

  private final String sourceRef;

  public AssetUnreadableException(String sourceRef, String message) {
    super(ErrorKind.ASSET_UNREADABLE, message);
    this.sourceRef = sourceRef;
  }

  public AssetUnreadableException(String sourceRef, String message, Throwable cause) {
    super(ErrorKind.ASSET_UNREADABLE, message, cause);
    this.sourceRef = sourceRef;
  }

  public String sourceRef() {
    return sourceRef;
  }
}

package com.scholary.podcast.audio;

/** Thrown when bytes are not a WAV file in the canonical format. */
public class WavFormatException extends RuntimeException {

  public WavFormatException(String message) {
    super(message);
  }
}

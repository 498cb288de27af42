package com.scholary.podcast.capture;

import java.io.InputStream;

/**
 * A live audio source for one meeting, such as a microphone or a meeting bot's audio feed.
 *
 * <p>{@link #startCapture()} is called once. The returned stream yields canonical PCM (16 kHz,
 * 16-bit, mono, little-endian) until {@link #stopCapture()} is called, after which it reports end
 * of stream. An I/O error or an end of stream before {@code stopCapture()} is a disconnect.
 */
public interface RecordingSource {

  /**
   * Start capturing.
   *
   * @return the PCM stream
   * @throws RecordingDisconnectedException if the source cannot be opened
   */
  InputStream startCapture();

  /** Stop capturing. Safe to call more than once, and before {@link #startCapture()}. */
  void stopCapture();
}

package com.scholary.podcast.whisper;

/** A streaming transcription session fed with canonical PCM as it is captured. */
public interface LiveTranscription extends AutoCloseable {

  /**
   * Queue captured audio.
   *
   * @param pcm buffer holding canonical PCM
   * @param length number of valid bytes in {@code pcm}
   */
  void feed(byte[] pcm, int length);

  /**
   * Flush buffered audio and wait until every chunk has been delivered to the listener.
   *
   * @throws WhisperException if any part of the session failed
   * @throws InterruptedException if interrupted while waiting
   */
  void finish() throws InterruptedException;

  /** Abandon the session. Pending audio is dropped. */
  @Override
  void close();
}

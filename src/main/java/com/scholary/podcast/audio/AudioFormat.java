package com.scholary.podcast.audio;

/**
 * Single source of truth for the pipeline's canonical audio format.
 *
 * <p>Every recording, narration clip and rendered podcast is 16 kHz, 16-bit signed PCM, mono,
 * little-endian.
 */
public final class AudioFormat {

  public static final int SAMPLE_RATE = 16_000;
  public static final int BITS_PER_SAMPLE = 16;
  public static final int CHANNELS = 1;
  public static final boolean SIGNED = true;
  public static final boolean BIG_ENDIAN = false;

  /** Bytes per PCM frame. */
  public static final int BLOCK_ALIGN = (BITS_PER_SAMPLE / 8) * CHANNELS;

  /** Bytes per second of audio. */
  public static final int BYTE_RATE = SAMPLE_RATE * BLOCK_ALIGN;

  public static final int WAV_HEADER_SIZE = 44;

  private AudioFormat() {}

  /** Number of samples covering the given number of seconds, rounded to the nearest sample. */
  public static int samplesFor(double seconds) {
    return (int) Math.round(seconds * SAMPLE_RATE);
  }

  public static double secondsFor(long samples) {
    return (double) samples / SAMPLE_RATE;
  }

  /** Java Sound representation of the canonical format. */
  public static javax.sound.sampled.AudioFormat toJavaSound() {
    return new javax.sound.sampled.AudioFormat(
        SAMPLE_RATE, BITS_PER_SAMPLE, CHANNELS, SIGNED, BIG_ENDIAN);
  }
}

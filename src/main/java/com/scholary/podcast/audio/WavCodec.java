package com.scholary.podcast.audio;

import static com.scholary.podcast.audio.AudioFormat.BITS_PER_SAMPLE;
import static com.scholary.podcast.audio.AudioFormat.BLOCK_ALIGN;
import static com.scholary.podcast.audio.AudioFormat.BYTE_RATE;
import static com.scholary.podcast.audio.AudioFormat.CHANNELS;
import static com.scholary.podcast.audio.AudioFormat.SAMPLE_RATE;
import static com.scholary.podcast.audio.AudioFormat.WAV_HEADER_SIZE;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Encodes and decodes PCM WAV data in the canonical format.
 *
 * <p>Only 16 kHz, 16-bit signed PCM, mono, little-endian is supported. Anything else is rejected
 * rather than resampled; uploads in other formats go through {@link FfmpegAudioConverter} first.
 */
public final class WavCodec {

  private static final int PCM_FORMAT_TAG = 1;

  private WavCodec() {}

  /** Wrap raw PCM16LE mono 16 kHz bytes in a 44-byte RIFF header. */
  public static byte[] encodePcm(byte[] pcm) {
    Objects.requireNonNull(pcm, "pcm must not be null");
    if (pcm.length % BLOCK_ALIGN != 0) {
      throw new IllegalArgumentException("PCM length must be a whole number of frames");
    }
    ByteBuffer buffer =
        ByteBuffer.allocate(WAV_HEADER_SIZE + pcm.length).order(ByteOrder.LITTLE_ENDIAN);
    buffer.put(new byte[] {'R', 'I', 'F', 'F'});
    buffer.putInt(36 + pcm.length);
    buffer.put(new byte[] {'W', 'A', 'V', 'E'});
    buffer.put(new byte[] {'f', 'm', 't', ' '});
    buffer.putInt(16);
    buffer.putShort((short) PCM_FORMAT_TAG);
    buffer.putShort((short) CHANNELS);
    buffer.putInt(SAMPLE_RATE);
    buffer.putInt(BYTE_RATE);
    buffer.putShort((short) BLOCK_ALIGN);
    buffer.putShort((short) BITS_PER_SAMPLE);
    buffer.put(new byte[] {'d', 'a', 't', 'a'});
    buffer.putInt(pcm.length);
    buffer.put(pcm);
    return buffer.array();
  }

  /** Encode samples as a canonical WAV file. */
  public static byte[] encode(short[] samples) {
    return encodePcm(toPcm(samples));
  }

  /**
   * Decode a canonical WAV file into samples.
   *
   * <p>Chunks other than {@code fmt } and {@code data} (LIST, fact, ...) are skipped.
   *
   * @throws WavFormatException if the bytes are not a canonical WAV file
   */
  public static short[] decode(byte[] wav) {
    Objects.requireNonNull(wav, "wav must not be null");
    if (wav.length < 12 || !tagEquals(wav, 0, "RIFF") || !tagEquals(wav, 8, "WAVE")) {
      throw new WavFormatException("Not a RIFF/WAVE file");
    }
    ByteBuffer buffer = ByteBuffer.wrap(wav).order(ByteOrder.LITTLE_ENDIAN);
    int position = 12;
    boolean formatSeen = false;
    while (position + 8 <= wav.length) {
      int chunkSize = buffer.getInt(position + 4);
      int bodyStart = position + 8;
      if (chunkSize < 0 || bodyStart + (long) chunkSize > wav.length) {
        // Streams written before their length was known report a bogus data size
        if (tagEquals(wav, position, "data") && formatSeen) {
          chunkSize = wav.length - bodyStart;
        } else {
          throw new WavFormatException("Truncated WAV chunk at offset " + position);
        }
      }
      if (tagEquals(wav, position, "fmt ")) {
        checkFormat(buffer, bodyStart, chunkSize);
        formatSeen = true;
      } else if (tagEquals(wav, position, "data")) {
        if (!formatSeen) {
          throw new WavFormatException("WAV data chunk precedes fmt chunk");
        }
        return toSamples(wav, bodyStart, chunkSize - (chunkSize % BLOCK_ALIGN));
      }
      position = bodyStart + chunkSize + (chunkSize & 1);
    }
    throw new WavFormatException("WAV file has no data chunk");
  }

  /** True when the file starts with a canonical WAV header. */
  public static boolean isCanonicalWav(Path file) throws IOException {
    byte[] header = new byte[WAV_HEADER_SIZE];
    try (InputStream in = Files.newInputStream(file)) {
      if (in.readNBytes(header, 0, header.length) < header.length) {
        return false;
      }
    }
    if (!tagEquals(header, 0, "RIFF") || !tagEquals(header, 8, "WAVE")) {
      return false;
    }
    if (!tagEquals(header, 12, "fmt ")) {
      return false;
    }
    try {
      checkFormat(ByteBuffer.wrap(header).order(ByteOrder.LITTLE_ENDIAN), 20, 16);
      return true;
    } catch (WavFormatException e) {
      return false;
    }
  }

  /** Write raw canonical PCM to a WAV file, replacing any existing file. */
  public static void writePcm(byte[] pcm, Path wavPath) throws IOException {
    Files.write(wavPath, encodePcm(pcm));
  }

  public static byte[] toPcm(short[] samples) {
    ByteBuffer buffer =
        ByteBuffer.allocate(samples.length * BLOCK_ALIGN).order(ByteOrder.LITTLE_ENDIAN);
    for (short sample : samples) {
      buffer.putShort(sample);
    }
    return buffer.array();
  }

  public static short[] toSamples(byte[] pcm, int offset, int length) {
    ByteBuffer buffer = ByteBuffer.wrap(pcm, offset, length).order(ByteOrder.LITTLE_ENDIAN);
    short[] samples = new short[length / BLOCK_ALIGN];
    for (int i = 0; i < samples.length; i++) {
      samples[i] = buffer.getShort();
    }
    return samples;
  }

  /** Duration in seconds of a canonical WAV file. */
  public static double durationSeconds(byte[] wav) {
    return AudioFormat.secondsFor(decode(wav).length);
  }

  private static void checkFormat(ByteBuffer buffer, int offset, int size) {
    if (size < 16) {
      throw new WavFormatException("WAV fmt chunk too short");
    }
    int formatTag = buffer.getShort(offset) & 0xFFFF;
    int channels = buffer.getShort(offset + 2) & 0xFFFF;
    int sampleRate = buffer.getInt(offset + 4);
    int bitsPerSample = buffer.getShort(offset + 14) & 0xFFFF;
    if (formatTag != PCM_FORMAT_TAG
        || channels != CHANNELS
        || sampleRate != SAMPLE_RATE
        || bitsPerSample != BITS_PER_SAMPLE) {
      throw new WavFormatException(
          String.format(
              "Unsupported WAV format: tag=%d, channels=%d, rate=%d, bits=%d",
              formatTag, channels, sampleRate, bitsPerSample));
    }
  }

  private static boolean tagEquals(byte[] data, int offset, String tag) {
    if (offset + 4 > data.length) {
      return false;
    }
    for (int i = 0; i < 4; i++) {
      if (data[offset + i] != (byte) tag.charAt(i)) {
        return false;
      }
    }
    return true;
  }
}

package com.scholary.podcast.assembly;

import com.scholary.podcast.audio.AudioFormat;
import com.scholary.podcast.audio.WavCodec;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Supplies the background music bed.
 *
 * <p>A configured WAV file is used when present. Otherwise a soft, seamlessly looping eight
 * second pad is generated; its partials complete a whole number of cycles per loop so repetition
 * does not click.
 */
@Component
public class MusicLibrary {

  private static final Logger LOGGER = LoggerFactory.getLogger(MusicLibrary.class);

  static final String BUILT_IN_REF = "music:built-in";
  private static final String FILE_REF_PREFIX = "music:file:";
  private static final double LOOP_SECONDS = 8.0;
  private static final double[] PARTIALS_HZ = {220.0, 277.125, 329.625};

  private final AssemblyProperties properties;

  public MusicLibrary(AssemblyProperties properties) {
    this.properties = properties;
  }

  /** Reference of the configured track, suitable for a {@code MUSIC_BED} entry. */
  public String trackRef() {
    String track = properties.musicTrack();
    return track == null || track.isBlank() ? BUILT_IN_REF : FILE_REF_PREFIX + track;
  }

  public boolean owns(String sourceRef) {
    return sourceRef.equals(BUILT_IN_REF) || sourceRef.startsWith(FILE_REF_PREFIX);
  }

  /**
   * Load a music track.
   *
   * @param sourceRef a reference returned by {@link #trackRef()}
   * @return canonical WAV bytes
   * @throws IOException if a configured file cannot be read
   */
  public byte[] load(String sourceRef) throws IOException {
    if (sourceRef.equals(BUILT_IN_REF)) {
      return builtInBed();
    }
    if (sourceRef.startsWith(FILE_REF_PREFIX)) {
      Path file = Path.of(sourceRef.substring(FILE_REF_PREFIX.length()));
      LOGGER.debug("Loading music track {}", file);
      return Files.readAllBytes(file);
    }
    throw new IOException("Not a music reference: " + sourceRef);
  }

  static byte[] builtInBed() {
    int total = AudioFormat.samplesFor(LOOP_SECONDS);
    short[] samples = new short[total];
    double amplitude = 0.15 * Short.MAX_VALUE / PARTIALS_HZ.length;
    for (int i = 0; i < total; i++) {
      double t = (double) i / AudioFormat.SAMPLE_RATE;
      // Slow swell, two per loop
      double swell = 0.75 + 0.25 * Math.sin(2 * Math.PI * t * 2 / LOOP_SECONDS);
      double value = 0;
      for (double hz : PARTIALS_HZ) {
        value += Math.sin(2 * Math.PI * hz * t);
      }
      samples[i] = (short) Math.round(amplitude * swell * value);
    }
    return WavCodec.encode(samples);
  }
}

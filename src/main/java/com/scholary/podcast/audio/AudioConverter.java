package com.scholary.podcast.audio;

import java.io.IOException;
import java.nio.file.Path;

/** Converts arbitrary audio files into the canonical WAV format, and WAV into MP3 for export. */
public interface AudioConverter {

  /**
   * Convert {@code input} to a canonical WAV file at {@code output}.
   *
   * @param input the uploaded audio file (mp3, m4a, wav at any rate, ...)
   * @param output where to write the canonical WAV file
   * @throws IOException if the input cannot be converted
   */
  void toCanonicalWav(Path input, Path output) throws IOException;

  /**
   * Encode a WAV file as MP3.
   *
   * @param wav the rendered podcast
   * @param mp3 where to write the MP3 file
   * @param bitrate encoder bitrate such as {@code 192k}
   * @throws IOException if the encoder is missing or fails
   */
  void toMp3(Path wav, Path mp3, String bitrate) throws IOException;
}

package com.scholary.podcast.audio;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Normalizes uploaded audio to 16 kHz mono PCM WAV using ffmpeg, and exports finished podcasts
 * as 44.1 kHz stereo MP3.
 *
 * <p>Files that already are canonical WAV are copied as-is, so the ffmpeg binary is only needed
 * for compressed or resampled uploads and for MP3 export.
 */
@Component
public class FfmpegAudioConverter implements AudioConverter {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegAudioConverter.class);
  private static final int MP3_SAMPLE_RATE = 44_100;

  private final FfmpegProperties properties;

  public FfmpegAudioConverter(FfmpegProperties properties) {
    this.properties = properties;
  }

  @Override
  public void toCanonicalWav(Path input, Path output) throws IOException {
    if (WavCodec.isCanonicalWav(input)) {
      LOGGER.debug("Input already canonical WAV, copying: {}", input.getFileName());
      Files.copy(input, output, StandardCopyOption.REPLACE_EXISTING);
      return;
    }

    List<String> command =
        List.of(
            properties.binary(),
            "-hide_banner",
            "-nostdin",
            "-i", input.toString(),
            "-vn",
            "-ac", String.valueOf(AudioFormat.CHANNELS),
            "-ar", String.valueOf(AudioFormat.SAMPLE_RATE),
            "-c:a", "pcm_s16le",
            "-f", "wav",
            "-y",
            output.toString());

    LOGGER.info("Converting {} to canonical WAV", input.getFileName());
    run(command, "conversion");

    if (!WavCodec.isCanonicalWav(output)) {
      throw new IOException("ffmpeg output is not canonical WAV: " + output.getFileName());
    }
  }

  @Override
  public void toMp3(Path wav, Path mp3, String bitrate) throws IOException {
    List<String> command =
        List.of(
            properties.binary(),
            "-hide_banner",
            "-nostdin",
            "-i", wav.toString(),
            "-codec:a", "libmp3lame",
            "-b:a", bitrate,
            "-ar", String.valueOf(MP3_SAMPLE_RATE),
            "-ac", "2",
            "-y",
            mp3.toString());

    LOGGER.info("Exporting {} as MP3 at {}", wav.getFileName(), bitrate);
    run(command, "MP3 export");

    if (!Files.exists(mp3) || Files.size(mp3) == 0) {
      throw new IOException("ffmpeg produced no MP3 output: " + mp3.getFileName());
    }
  }

  private void run(List<String> command, String operation) throws IOException {
    LOGGER.debug("Executing: {}", String.join(" ", command));

    ProcessBuilder pb = new ProcessBuilder(command);
    pb.redirectErrorStream(true);
    Path log = Files.createTempFile("ffmpeg-", ".log");
    pb.redirectOutput(log.toFile());

    try {
      Process process = pb.start();
      if (!process.waitFor(properties.timeoutSeconds(), TimeUnit.SECONDS)) {
        process.destroyForcibly();
        throw new IOException(
            "ffmpeg " + operation + " timed out after " + properties.timeoutSeconds() + "s");
      }
      int exitCode = process.exitValue();
      if (exitCode != 0) {
        String error = Files.readString(log);
        throw new IOException(
            "ffmpeg " + operation + " failed with exit code " + exitCode + ": " + error);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IOException("ffmpeg " + operation + " interrupted", e);
    } finally {
      Files.deleteIfExists(log);
    }
  }
}

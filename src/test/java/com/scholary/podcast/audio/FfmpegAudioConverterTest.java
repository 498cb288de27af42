package com.scholary.podcast.audio;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FfmpegAudioConverterTest {

  @TempDir Path tempDir;

  private final FfmpegAudioConverter converter =
      new FfmpegAudioConverter(new FfmpegProperties("ffmpeg-binary-that-does-not-exist", 5));

  @Test
  void toCanonicalWav_shouldCopyCanonicalInputWithoutFfmpeg() throws Exception {
    Path input = tempDir.resolve("meeting.wav");
    byte[] wav = WavCodec.encode(new short[] {10, 20, 30});
    Files.write(input, wav);
    Path output = tempDir.resolve("recording.wav");

    converter.toCanonicalWav(input, output);

    assertThat(Files.readAllBytes(output)).isEqualTo(wav);
  }

  @Test
  void toCanonicalWav_shouldReportMissingBinaryAsIoFailure() throws Exception {
    Path input = tempDir.resolve("meeting.mp3");
    Files.write(input, "DUMMY_MP3_DATA".getBytes());

    assertThatThrownBy(() -> converter.toCanonicalWav(input, tempDir.resolve("out.wav")))
        .isInstanceOf(IOException.class);
  }

  @Test
  void toMp3_shouldReportMissingEncoderAsIoFailure() throws Exception {
    Path wav = tempDir.resolve("podcast.wav");
    Files.write(wav, WavCodec.encode(new short[] {10, 20, 30}));
    Path mp3 = tempDir.resolve("podcast.mp3");

    assertThatThrownBy(() -> converter.toMp3(wav, mp3, "192k"))
        .isInstanceOf(IOException.class)
        .hasMessageContaining("ffmpeg-binary-that-does-not-exist");
    assertThat(mp3).doesNotExist();
  }
}

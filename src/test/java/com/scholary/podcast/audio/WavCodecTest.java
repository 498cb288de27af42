package com.scholary.podcast.audio;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class WavCodecTest {

  @TempDir Path tempDir;

  @Test
  void encode_shouldWriteCanonicalHeader() {
    byte[] wav = WavCodec.encode(new short[] {1, -1, 1000, -1000});

    ByteBuffer header = ByteBuffer.wrap(wav).order(ByteOrder.LITTLE_ENDIAN);
    assertThat(wav).hasSize(AudioFormat.WAV_HEADER_SIZE + 8);
    assertThat(new String(wav, 0, 4)).isEqualTo("RIFF");
    assertThat(new String(wav, 8, 4)).isEqualTo("WAVE");
    assertThat(header.getShort(20)).isEqualTo((short) 1);
    assertThat(header.getShort(22)).isEqualTo((short) 1);
    assertThat(header.getInt(24)).isEqualTo(16_000);
    assertThat(header.getInt(28)).isEqualTo(32_000);
    assertThat(header.getShort(34)).isEqualTo((short) 16);
    assertThat(header.getInt(40)).isEqualTo(8);
  }

  @Test
  void decode_shouldReturnEncodedSamples() {
    short[] samples = {0, 1, -1, Short.MAX_VALUE, Short.MIN_VALUE};

    assertThat(WavCodec.decode(WavCodec.encode(samples))).containsExactly(samples);
  }

  @Test
  void decode_shouldSkipUnknownChunks() {
    byte[] canonical = WavCodec.encode(new short[] {7, 8, 9});
    // Insert a LIST chunk between fmt and data
    ByteBuffer withList =
        ByteBuffer.allocate(canonical.length + 12).order(ByteOrder.LITTLE_ENDIAN);
    withList.put(canonical, 0, 36);
    withList.put(new byte[] {'L', 'I', 'S', 'T'});
    withList.putInt(4);
    withList.put(new byte[] {'I', 'N', 'F', 'O'});
    withList.put(canonical, 36, canonical.length - 36);

    assertThat(WavCodec.decode(withList.array())).containsExactly((short) 7, (short) 8, (short) 9);
  }

  @Test
  void decode_shouldRejectOtherSampleRates() {
    byte[] wav = WavCodec.encode(new short[] {1, 2});
    ByteBuffer.wrap(wav).order(ByteOrder.LITTLE_ENDIAN).putInt(24, 44_100);

    assertThatThrownBy(() -> WavCodec.decode(wav))
        .isInstanceOf(WavFormatException.class)
        .hasMessageContaining("rate=44100");
  }

  @Test
  void decode_shouldRejectNonWavBytes() {
    assertThatThrownBy(() -> WavCodec.decode("DUMMY_MP3_DATA".getBytes()))
        .isInstanceOf(WavFormatException.class);
  }

  @Test
  void durationSeconds_shouldFollowSampleCount() {
    byte[] wav = WavCodec.encode(new short[AudioFormat.samplesFor(2.5)]);

    assertThat(WavCodec.durationSeconds(wav)).isEqualTo(2.5);
  }

  @Test
  void isCanonicalWav_shouldDetectFormat() throws Exception {
    Path wav = tempDir.resolve("ok.wav");
    WavCodec.writePcm(new byte[64], wav);
    Path mp3 = tempDir.resolve("meeting.mp3");
    Files.write(mp3, new byte[] {'I', 'D', '3', 4, 0, 0, 0, 0, 0, 0});

    assertThat(WavCodec.isCanonicalWav(wav)).isTrue();
    assertThat(WavCodec.isCanonicalWav(mp3)).isFalse();
  }

  @Test
  void encodePcm_shouldRejectPartialFrames() {
    assertThatThrownBy(() -> WavCodec.encodePcm(new byte[3]))
        .isInstanceOf(IllegalArgumentException.class);
  }
}

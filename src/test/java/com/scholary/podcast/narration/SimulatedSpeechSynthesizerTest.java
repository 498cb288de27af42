package com.scholary.podcast.narration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.scholary.podcast.audio.WavCodec;
import org.junit.jupiter.api.Test;

class SimulatedSpeechSynthesizerTest {

  private final SimulatedSpeechSynthesizer synthesizer = new SimulatedSpeechSynthesizer();

  @Test
  void synthesize_shouldProduceCanonicalWavScaledByWordCount() {
    byte[] wav = synthesizer.synthesize("one two three four five six seven eight", VoiceId.MALE);

    assertThat(WavCodec.durationSeconds(wav)).isCloseTo(2.4, within(1e-9));
  }

  @Test
  void synthesize_shouldLastAtLeastOneSecond() {
    assertThat(WavCodec.durationSeconds(synthesizer.synthesize("Hi", VoiceId.DEFAULT)))
        .isCloseTo(1.0, within(1e-9));
  }

  @Test
  void synthesize_shouldBeDeterministicPerVoice() {
    String text = "Same words every time";

    assertThat(synthesizer.synthesize(text, VoiceId.BRITISH))
        .isEqualTo(synthesizer.synthesize(text, VoiceId.BRITISH))
        .isNotEqualTo(synthesizer.synthesize(text, VoiceId.AMERICAN));
  }

  @Test
  void synthesize_shouldRejectBlankText() {
    assertThatThrownBy(() -> synthesizer.synthesize(" ", VoiceId.DEFAULT))
        .isInstanceOfSatisfying(
            SpeechSynthesisException.class,
            e -> assertThat(e.reason()).isEqualTo(SpeechSynthesisException.Reason.PERMANENT));
  }
}

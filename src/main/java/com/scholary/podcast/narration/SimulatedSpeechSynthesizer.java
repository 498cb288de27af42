package com.scholary.podcast.narration;

import com.scholary.podcast.audio.AudioFormat;
import com.scholary.podcast.audio.WavCodec;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Deterministic stand-in for a speech vendor, used in simulation mode and tests.
 *
 * <p>Produces a voiced tone whose pitch depends on the voice and whose length is
 * {@value #SECONDS_PER_WORD} s per word (at least one second). Each word is one amplitude bump
 * separated by a short pause, which gives the clip a speech-like envelope for the mixer.
 */
public class SimulatedSpeechSynthesizer implements SpeechSynthesizer {

  static final double SECONDS_PER_WORD = 0.3;
  private static final double MIN_SECONDS = 1.0;
  private static final double AMPLITUDE = 0.3 * Short.MAX_VALUE;
  private static final Pattern WORDS = Pattern.compile("\\s+");

  private static final Map<VoiceId, Double> PITCH_HZ =
      Map.of(
          VoiceId.DEFAULT, 180.0,
          VoiceId.MALE, 120.0,
          VoiceId.FEMALE, 220.0,
          VoiceId.BRITISH, 200.0,
          VoiceId.AMERICAN, 160.0);

  @Override
  public byte[] synthesize(String text, VoiceId voice) {
    if (text == null || text.isBlank()) {
      throw new SpeechSynthesisException(
          SpeechSynthesisException.Reason.PERMANENT, "Nothing to synthesize");
    }
    Double pitch = PITCH_HZ.get(voice);
    if (pitch == null) {
      throw new SpeechSynthesisException(
          SpeechSynthesisException.Reason.INVALID_VOICE, "Unknown voice " + voice);
    }

    int words = WORDS.split(text.trim()).length;
    double seconds = Math.max(MIN_SECONDS, words * SECONDS_PER_WORD);
    int total = AudioFormat.samplesFor(seconds);
    int perWord = AudioFormat.samplesFor(SECONDS_PER_WORD);
    int voiced = (int) (perWord * 0.8);

    short[] samples = new short[total];
    for (int i = 0; i < total; i++) {
      int inWord = i % perWord;
      if (inWord >= voiced) {
        continue;
      }
      double envelope = Math.sin(Math.PI * inWord / voiced);
      double t = (double) i / AudioFormat.SAMPLE_RATE;
      double wave =
          Math.sin(2 * Math.PI * pitch * t) + 0.5 * Math.sin(2 * Math.PI * 2 * pitch * t);
      samples[i] = (short) Math.round(AMPLITUDE * envelope * wave / 1.5);
    }
    return WavCodec.encode(samples);
  }
}

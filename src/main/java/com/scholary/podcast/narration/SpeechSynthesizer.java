package com.scholary.podcast.narration;

/** Vendor-facing text-to-speech call. One invocation is one attempt; retries happen above it. */
public interface SpeechSynthesizer {

  /**
   * Render text as speech.
   *
   * @param text the narration text
   * @param voice the requested voice
   * @return a WAV file in the canonical format
   * @throws SpeechSynthesisException classified as transient, permanent or invalid-voice
   */
  byte[] synthesize(String text, VoiceId voice);
}

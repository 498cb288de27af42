package com.scholary.podcast.narration;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.scholary.podcast.audio.AudioFormat;
import com.scholary.podcast.audio.WavCodec;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Arrays;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP client for an ElevenLabs-style text-to-speech API.
 *
 * <p>Requests raw 16 kHz PCM ({@code output_format=pcm_16000}) and wraps it in a WAV header, so
 * the returned clip is already in the canonical format. HTTP status codes are mapped onto
 * {@link SpeechSynthesisException.Reason}: 408, 429 and 5xx are transient, 404 means the voice is
 * unknown, every other 4xx is permanent.
 */
public class HttpSpeechSynthesizer implements SpeechSynthesizer {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpSpeechSynthesizer.class);

  private final HttpClient httpClient;
  private final TtsProperties properties;
  private final ObjectMapper objectMapper;

  public HttpSpeechSynthesizer(TtsProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info("Initialized speech synthesizer client: baseUrl={}", properties.baseUrl());
  }

  @Override
  public byte[] synthesize(String text, VoiceId voice) {
    String vendorVoice = resolveVoice(voice);

    HttpResponse<byte[]> response;
    try {
      ObjectNode body = objectMapper.createObjectNode();
      body.put("text", text);
      if (properties.modelId() != null && !properties.modelId().isBlank()) {
        body.put("model_id", properties.modelId());
      }

      HttpRequest.Builder builder =
          HttpRequest.newBuilder()
              .uri(
                  URI.create(
                      properties.baseUrl()
                          + "/v1/text-to-speech/"
                          + vendorVoice
                          + "?output_format=pcm_16000"))
              .timeout(Duration.ofSeconds(properties.readTimeout()))
              .header("Content-Type", "application/json")
              .header("Accept", "audio/pcm")
              .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(body)));
      if (properties.apiKey() != null && !properties.apiKey().isBlank()) {
        builder.header("xi-api-key", properties.apiKey());
      }

      LOGGER.debug("Sending synthesis request: voice={}, chars={}", voice, text.length());
      response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());

    } catch (HttpTimeoutException e) {
      throw new SpeechSynthesisException(
          SpeechSynthesisException.Reason.TRANSIENT, "Synthesis request timed out", e);
    } catch (IOException e) {
      throw new SpeechSynthesisException(
          SpeechSynthesisException.Reason.TRANSIENT,
          "Synthesis request failed: " + e.getMessage(),
          e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new SpeechSynthesisException(
          SpeechSynthesisException.Reason.PERMANENT, "Synthesis request interrupted", e);
    }

    int status = response.statusCode();
    if (status == 200) {
      byte[] pcm = response.body();
      // Trailing odd byte would misalign frames
      int usable = pcm.length - (pcm.length % AudioFormat.BLOCK_ALIGN);
      byte[] aligned = usable == pcm.length ? pcm : Arrays.copyOf(pcm, usable);
      return WavCodec.encodePcm(aligned);
    }

    String detail = new String(response.body(), StandardCharsets.UTF_8);
    throw new SpeechSynthesisException(
        classify(status), String.format("Synthesizer returned status %d: %s", status, detail));
  }

  private String resolveVoice(VoiceId voice) {
    Map<String, String> voices = properties.voices() == null ? Map.of() : properties.voices();
    String vendorVoice = voices.get(voice.tag());
    if (vendorVoice == null || vendorVoice.isBlank()) {
      throw new SpeechSynthesisException(
          SpeechSynthesisException.Reason.INVALID_VOICE,
          "No vendor voice configured for '" + voice.tag() + "'");
    }
    return vendorVoice;
  }

  static SpeechSynthesisException.Reason classify(int status) {
    if (status == 408 || status == 429 || status >= 500) {
      return SpeechSynthesisException.Reason.TRANSIENT;
    }
    if (status == 404) {
      return SpeechSynthesisException.Reason.INVALID_VOICE;
    }
    return SpeechSynthesisException.Reason.PERMANENT;
  }
}

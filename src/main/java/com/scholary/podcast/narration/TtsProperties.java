package com.scholary.podcast.narration;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Connection settings for the text-to-speech vendor.
 *
 * @param baseUrl vendor API root
 * @param apiKey API key sent with every request
 * @param modelId vendor model to synthesize with
 * @param connectTimeout connect timeout in seconds
 * @param readTimeout request timeout in seconds
 * @param voices vendor voice id per voice name ({@code default}, {@code male}, ...)
 */
@ConfigurationProperties(prefix = "tts")
@Validated
public record TtsProperties(
    @NotBlank String baseUrl,
    String apiKey,
    String modelId,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    Map<String, String> voices) {}

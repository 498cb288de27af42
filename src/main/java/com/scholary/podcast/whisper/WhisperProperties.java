package com.scholary.podcast.whisper;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for Whisper API client.
 *
 * <p>These control how we connect to the Whisper service (or mock), handle timeouts/retries and
 * how much live audio is sent per request.
 */
@ConfigurationProperties(prefix = "whisper")
@Validated
public record WhisperProperties(
    @NotBlank String baseUrl,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int maxRetries,
    @PositiveOrZero long retryBackoffMs,
    @Positive double liveWindowSeconds) {}

package com.scholary.podcast.selection;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/** Connection settings for the external content scorer. */
@ConfigurationProperties(prefix = "scorer")
@Validated
public record ScorerProperties(
    @NotBlank String baseUrl,
    String apiKey,
    @Positive int connectTimeout,
    @Positive int readTimeout) {}

package com.scholary.podcast.audio;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for ffmpeg operations.
 *
 * @param binary path or name of the ffmpeg executable
 * @param timeoutSeconds upper bound for a single conversion
 */
@ConfigurationProperties(prefix = "ffmpeg")
@Validated
public record FfmpegProperties(@NotBlank String binary, @Positive int timeoutSeconds) {}

package com.scholary.podcast.capture;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Microphone capture settings.
 *
 * @param deviceName mixer name to record from; blank uses the system default line
 * @param lineBufferMillis size of the Java Sound line buffer
 */
@ConfigurationProperties(prefix = "podcast.capture")
@Validated
public record CaptureProperties(String deviceName, @Positive int lineBufferMillis) {}

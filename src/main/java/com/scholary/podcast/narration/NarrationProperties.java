package com.scholary.podcast.narration;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Retry and parallelism settings for narration.
 *
 * @param maxAttempts total attempts per segment
 * @param initialBackoffMs wait after the first failure
 * @param backoffMultiplier growth factor between waits
 * @param maxBackoffMs cap for a single wait
 * @param concurrency how many segments of one job are synthesized in parallel
 * @param poolSize threads of the narration executor shared by all jobs
 * @param queueSize segment tasks waiting for a narration thread before submissions are refused
 */
@ConfigurationProperties(prefix = "podcast.narration")
@Validated
public record NarrationProperties(
    @Positive int maxAttempts,
    @PositiveOrZero long initialBackoffMs,
    @DecimalMin("1.0") double backoffMultiplier,
    @PositiveOrZero long maxBackoffMs,
    @Positive int concurrency,
    @Positive int poolSize,
    @Positive int queueSize) {

  public RetryPolicy retryPolicy() {
    return new RetryPolicy(
        maxAttempts,
        Duration.ofMillis(initialBackoffMs),
        backoffMultiplier,
        Duration.ofMillis(maxBackoffMs));
  }
}

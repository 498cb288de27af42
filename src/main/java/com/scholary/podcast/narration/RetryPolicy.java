package com.scholary.podcast.narration;

import java.time.Duration;

/**
 * Bounded exponential backoff for synthesis calls.
 *
 * @param maxAttempts total attempts including the first one
 * @param initialBackoff wait after the first failed attempt
 * @param multiplier growth factor between consecutive waits
 * @param maxBackoff cap for a single wait
 */
public record RetryPolicy(
    int maxAttempts, Duration initialBackoff, double multiplier, Duration maxBackoff) {

  public RetryPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1");
    }
    if (initialBackoff.isNegative() || maxBackoff.isNegative()) {
      throw new IllegalArgumentException("Backoff durations cannot be negative");
    }
    if (multiplier < 1.0) {
      throw new IllegalArgumentException("multiplier must be >= 1");
    }
  }

  /** Three attempts, 1 s base, doubling, capped at 8 s. */
  public static RetryPolicy defaults() {
    return new RetryPolicy(3, Duration.ofSeconds(1), 2.0, Duration.ofSeconds(8));
  }

  /**
   * Wait before the next attempt.
   *
   * @param failedAttempt the 1-based number of the attempt that just failed
   * @return the backoff, never longer than {@code maxBackoff}
   */
  public Duration backoffAfter(int failedAttempt) {
    double millis = initialBackoff.toMillis() * Math.pow(multiplier, failedAttempt - 1);
    return Duration.ofMillis((long) Math.min(millis, maxBackoff.toMillis()));
  }
}

package com.scholary.audiobook.handler.retry;

import java.time.Duration;

/**
 * Bounded exponential backoff.
 *
 * <p>The delay before retry {@code n} (1-based) is {@code initialDelay * multiplier^(n-1)}, capped at
 * {@code maxDelay}. After {@code maxAttempts} calls in total the operation gives up.
 */
public record BackoffPolicy(
    Duration initialDelay, Duration maxDelay, double multiplier, int maxAttempts) {

  public BackoffPolicy {
    if (initialDelay == null || initialDelay.isNegative()) {
      throw new IllegalArgumentException("Initial delay must be zero or positive");
    }
    if (maxDelay == null || maxDelay.compareTo(initialDelay) < 0) {
      throw new IllegalArgumentException("Max delay must be >= initial delay");
    }
    if (multiplier < 1.0) {
      throw new IllegalArgumentException("Multiplier must be >= 1");
    }
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("At least one attempt is required");
    }
  }

  public Duration delayBeforeRetry(int retry) {
    if (retry < 1) {
      throw new IllegalArgumentException("Retry number is 1-based");
    }
    double millis = initialDelay.toMillis() * Math.pow(multiplier, retry - 1);
    if (millis >= maxDelay.toMillis()) {
      return maxDelay;
    }
    return Duration.ofMillis((long) millis);
  }
}

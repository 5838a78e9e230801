package com.streamfirst.shush.application;

import java.time.Duration;

/**
 * Capped exponential backoff with full jitter: each delay is drawn uniformly between
 * zero and the capped exponential bound.
 *
 * @param maxAttempts total attempts including the first one
 * @param baseDelay delay before the first retry, doubled on every further retry
 * @param maxDelay upper bound for a single delay
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay, Duration maxDelay) {

  public static final RetryPolicy DEFAULT =
      new RetryPolicy(4, Duration.ofMillis(200), Duration.ofSeconds(2));

  public static final RetryPolicy NONE = new RetryPolicy(1, Duration.ZERO, Duration.ZERO);

  public RetryPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1");
    }
    if (baseDelay.isNegative() || maxDelay.isNegative()) {
      throw new IllegalArgumentException("retry delays cannot be negative");
    }
  }

  /**
   * Delay before the given retry.
   *
   * @param retry 1 for the first retry
   * @param jitter a value in [0, 1)
   */
  public Duration backoff(int retry, double jitter) {
    long base = baseDelay.toMillis();
    long cap = maxDelay.toMillis();
    long exponential = retry >= 31 ? cap : Math.min(cap, base * (1L << (retry - 1)));
    return Duration.ofMillis((long) (jitter * exponential));
  }
}

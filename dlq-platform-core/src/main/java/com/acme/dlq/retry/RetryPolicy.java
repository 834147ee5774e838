package com.acme.dlq.retry;

import java.time.Duration;

/**
 * Exponential backoff parameters: {@code delay(n) = min(baseDelay * multiplier^(n-1), maxDelay)}
 * plus up to {@code jitterFraction * delay} of random jitter.
 */
public record RetryPolicy(
    Duration baseDelay,
    Duration maxDelay,
    double multiplier,
    double jitterFraction,
    boolean jitterEnabled) {

  public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);
  public static final Duration DEFAULT_MAX_DELAY = Duration.ofMinutes(5);
  public static final double DEFAULT_MULTIPLIER = 2.0;
  public static final double DEFAULT_JITTER_FRACTION = 0.10;

  public RetryPolicy {
    if (baseDelay == null || baseDelay.toMillis() < 1) {
      throw new IllegalArgumentException("baseDelay must be at least 1ms: " + baseDelay);
    }
    if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
      throw new IllegalArgumentException(
          "maxDelay must be >= baseDelay: " + maxDelay + " < " + baseDelay);
    }
    if (multiplier < 1.0 || Double.isNaN(multiplier) || Double.isInfinite(multiplier)) {
      throw new IllegalArgumentException("multiplier must be >= 1: " + multiplier);
    }
    if (jitterFraction < 0.0 || jitterFraction > 1.0 || Double.isNaN(jitterFraction)) {
      throw new IllegalArgumentException("jitterFraction must be within [0, 1]: " + jitterFraction);
    }
  }

  /** 1s base, 5m cap, doubling, 10% jitter. */
  public static RetryPolicy defaults() {
    return new RetryPolicy(
        DEFAULT_BASE_DELAY, DEFAULT_MAX_DELAY, DEFAULT_MULTIPLIER, DEFAULT_JITTER_FRACTION, true);
  }

  public RetryPolicy withoutJitter() {
    return new RetryPolicy(baseDelay, maxDelay, multiplier, jitterFraction, false);
  }
}

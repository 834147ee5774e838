package com.acme.dlq.retry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Computes when the next retry of a message may run.
 *
 * <p>Deterministic apart from the jitter draw; both the clock and the jitter source are injected.
 * The jitter source must return values in {@code [0, 1)}.
 */
public class BackoffCalculator {

  private final RetryPolicy policy;
  private final Clock clock;
  private final DoubleSupplier jitterSource;

  /** First attempt number whose uncapped delay reaches maxDelay; later attempts reuse maxDelay. */
  private final int saturationAttempt;

  public BackoffCalculator(RetryPolicy policy, Clock clock) {
    this(policy, clock, () -> ThreadLocalRandom.current().nextDouble());
  }

  public BackoffCalculator(RetryPolicy policy, Clock clock, DoubleSupplier jitterSource) {
    this.policy = policy;
    this.clock = clock;
    this.jitterSource = jitterSource;
    this.saturationAttempt = computeSaturationAttempt(policy);
  }

  /** Instant of the next retry after the given failed attempt, measured from now. */
  public Instant nextRetryTime(int attemptNumber) {
    return clock.instant().plus(delayFor(attemptNumber));
  }

  /**
   * Delay before the retry that follows the given attempt, jitter included.
   *
   * @throws IllegalArgumentException if {@code attemptNumber < 1}
   */
  public Duration delayFor(int attemptNumber) {
    long delay = baseDelayFor(attemptNumber);
    if (policy.jitterEnabled() && policy.jitterFraction() > 0) {
      double draw = jitterSource.getAsDouble();
      delay += (long) (delay * policy.jitterFraction() * draw);
    }
    return Duration.ofMillis(delay);
  }

  /** Capped exponential delay in milliseconds, without jitter. */
  public long baseDelayFor(int attemptNumber) {
    if (attemptNumber < 1) {
      throw new IllegalArgumentException("attemptNumber must be >= 1: " + attemptNumber);
    }
    long max = policy.maxDelay().toMillis();
    if (attemptNumber >= saturationAttempt) {
      return max;
    }
    double uncapped =
        policy.baseDelay().toMillis() * Math.pow(policy.multiplier(), attemptNumber - 1);
    return (long) Math.min(uncapped, max);
  }

  public RetryPolicy policy() {
    return policy;
  }

  private static int computeSaturationAttempt(RetryPolicy policy) {
    long base = policy.baseDelay().toMillis();
    long max = policy.maxDelay().toMillis();
    if (policy.multiplier() <= 1.0) {
      return base >= max ? 1 : Integer.MAX_VALUE;
    }
    double delay = base;
    int attempt = 1;
    while (delay < max) {
      delay *= policy.multiplier();
      attempt++;
    }
    return attempt;
  }
}

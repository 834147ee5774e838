package com.acme.dlq.config;

import com.acme.dlq.retry.RetryPolicy;
import java.time.Duration;

/**
 * Configuration for DLQ retry, expiration and query settings. Pure POJO - no framework
 * dependencies.
 */
public class DlqConfig {

  private int defaultMaxRetries = 3;
  private Duration defaultExpiration = Duration.ofDays(7);
  private Duration baseDelay = RetryPolicy.DEFAULT_BASE_DELAY;
  private Duration maxDelay = RetryPolicy.DEFAULT_MAX_DELAY;
  private double backoffMultiplier = RetryPolicy.DEFAULT_MULTIPLIER;
  private double jitterFraction = RetryPolicy.DEFAULT_JITTER_FRACTION;
  private boolean jitterEnabled = true;
  private int defaultQueryLimit = 100;
  private int maxQueryLimit = 1000;
  private int sweepBatchSize = 1000;
  private Duration processorTimeout = Duration.ofSeconds(30); // zero disables the timeout
  private int processorThreads = 16;
  private Duration processingLease = Duration.ofMinutes(5); // PROCESSING older than this is abandoned
  private Scheduler scheduler = new Scheduler();

  public int getDefaultMaxRetries() {
    return defaultMaxRetries;
  }

  public void setDefaultMaxRetries(int defaultMaxRetries) {
    this.defaultMaxRetries = defaultMaxRetries;
  }

  public Duration getDefaultExpiration() {
    return defaultExpiration;
  }

  public void setDefaultExpiration(Duration defaultExpiration) {
    this.defaultExpiration = defaultExpiration;
  }

  public Duration getBaseDelay() {
    return baseDelay;
  }

  public void setBaseDelay(Duration baseDelay) {
    this.baseDelay = baseDelay;
  }

  public Duration getMaxDelay() {
    return maxDelay;
  }

  public void setMaxDelay(Duration maxDelay) {
    this.maxDelay = maxDelay;
  }

  public double getBackoffMultiplier() {
    return backoffMultiplier;
  }

  public void setBackoffMultiplier(double backoffMultiplier) {
    this.backoffMultiplier = backoffMultiplier;
  }

  public double getJitterFraction() {
    return jitterFraction;
  }

  public void setJitterFraction(double jitterFraction) {
    this.jitterFraction = jitterFraction;
  }

  public boolean isJitterEnabled() {
    return jitterEnabled;
  }

  public void setJitterEnabled(boolean jitterEnabled) {
    this.jitterEnabled = jitterEnabled;
  }

  public int getDefaultQueryLimit() {
    return defaultQueryLimit;
  }

  public void setDefaultQueryLimit(int defaultQueryLimit) {
    this.defaultQueryLimit = defaultQueryLimit;
  }

  public int getMaxQueryLimit() {
    return maxQueryLimit;
  }

  public void setMaxQueryLimit(int maxQueryLimit) {
    this.maxQueryLimit = maxQueryLimit;
  }

  public int getSweepBatchSize() {
    return sweepBatchSize;
  }

  public void setSweepBatchSize(int sweepBatchSize) {
    this.sweepBatchSize = sweepBatchSize;
  }

  public Duration getProcessorTimeout() {
    return processorTimeout;
  }

  public void setProcessorTimeout(Duration processorTimeout) {
    this.processorTimeout = processorTimeout;
  }

  public int getProcessorThreads() {
    return processorThreads;
  }

  public void setProcessorThreads(int processorThreads) {
    this.processorThreads = processorThreads;
  }

  public Duration getProcessingLease() {
    return processingLease;
  }

  public void setProcessingLease(Duration processingLease) {
    this.processingLease = processingLease;
  }

  public Scheduler getScheduler() {
    return scheduler;
  }

  public void setScheduler(Scheduler scheduler) {
    this.scheduler = scheduler;
  }

  /** Build the retry policy from the backoff settings; validates them. */
  public RetryPolicy toRetryPolicy() {
    return new RetryPolicy(baseDelay, maxDelay, backoffMultiplier, jitterFraction, jitterEnabled);
  }

  /**
   * Check settings that depend on each other.
   *
   * <p>A processing lease must outlast the processor timeout, otherwise a message whose processor is
   * still running could be claimed and processed a second time. With the timeout disabled the lease
   * is the only bound on a stuck processor and is not checked.
   *
   * @throws IllegalArgumentException if the settings are inconsistent
   */
  public void validate() {
    toRetryPolicy();
    if (processingLease == null || processingLease.isZero() || processingLease.isNegative()) {
      throw new IllegalArgumentException("processingLease must be positive: " + processingLease);
    }
    if (processorThreads < 1) {
      throw new IllegalArgumentException("processorThreads must be >= 1: " + processorThreads);
    }
    boolean timeoutEnabled =
        processorTimeout != null && !processorTimeout.isZero() && !processorTimeout.isNegative();
    if (timeoutEnabled && processingLease.compareTo(processorTimeout) <= 0) {
      throw new IllegalArgumentException(
          "processingLease ("
              + processingLease
              + ") must be longer than processorTimeout ("
              + processorTimeout
              + ")");
    }
  }

  /**
   * Clamp a caller-supplied query limit to {@code [1, maxQueryLimit]}. Non-positive limits fall
   * back to the default limit.
   */
  public int clampLimit(int requested) {
    int limit = requested > 0 ? requested : defaultQueryLimit;
    return Math.max(1, Math.min(limit, maxQueryLimit));
  }

  public static class Scheduler {
    private boolean enabled = false;
    private Duration retryInterval = Duration.ofSeconds(30);
    private Duration sweepInterval = Duration.ofMinutes(5);
    private int retryBatchSize = 100;

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public Duration getRetryInterval() {
      return retryInterval;
    }

    public void setRetryInterval(Duration retryInterval) {
      this.retryInterval = retryInterval;
    }

    public Duration getSweepInterval() {
      return sweepInterval;
    }

    public void setSweepInterval(Duration sweepInterval) {
      this.sweepInterval = sweepInterval;
    }

    public int getRetryBatchSize() {
      return retryBatchSize;
    }

    public void setRetryBatchSize(int retryBatchSize) {
      this.retryBatchSize = retryBatchSize;
    }
  }
}

package com.acme.dlq.service;

import java.time.Instant;

/**
 * Structured result of a retry-drive call. Expected failure modes are reported here and never
 * thrown, so batch callers need no per-item error handling.
 *
 * @param retryCount retry count after the call, or null when not applicable
 * @param nextRetryAt earliest next attempt, or null when not applicable
 */
public record ProcessingResult(
    boolean success, ProcessingOutcome outcome, Integer retryCount, Instant nextRetryAt) {

  public static ProcessingResult processed(int retryCount) {
    return new ProcessingResult(true, ProcessingOutcome.PROCESSED, retryCount, null);
  }

  public static ProcessingResult notFound() {
    return new ProcessingResult(false, ProcessingOutcome.NOT_FOUND, null, null);
  }

  public static ProcessingResult alreadyResolved() {
    return new ProcessingResult(true, ProcessingOutcome.ALREADY_RESOLVED, null, null);
  }

  public static ProcessingResult expired() {
    return new ProcessingResult(false, ProcessingOutcome.EXPIRED, null, null);
  }

  public static ProcessingResult retryBudgetExhausted(int retryCount) {
    return new ProcessingResult(false, ProcessingOutcome.RETRY_BUDGET_EXHAUSTED, retryCount, null);
  }

  public static ProcessingResult notYetEligible(Instant nextRetryAt) {
    return new ProcessingResult(false, ProcessingOutcome.NOT_YET_ELIGIBLE, null, nextRetryAt);
  }

  public static ProcessingResult inProgress() {
    return new ProcessingResult(false, ProcessingOutcome.IN_PROGRESS, null, null);
  }

  public static ProcessingResult concurrentModification() {
    return new ProcessingResult(false, ProcessingOutcome.CONCURRENT_MODIFICATION, null, null);
  }

  public static ProcessingResult processorFailed(int retryCount, Instant nextRetryAt) {
    return new ProcessingResult(false, ProcessingOutcome.PROCESSOR_FAILED, retryCount, nextRetryAt);
  }

  /** Wire code of the outcome, e.g. {@code not_yet_eligible}. */
  public String reason() {
    return outcome.code();
  }
}

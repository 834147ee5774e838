package com.acme.dlq.service;

/**
 * Why a retry-drive call ended the way it did. Only {@link #PROCESSOR_FAILED} mutates retry state.
 */
public enum ProcessingOutcome {
  PROCESSED("processed"),
  NOT_FOUND("not_found"),
  ALREADY_RESOLVED("already_resolved"),
  EXPIRED("expired"),
  RETRY_BUDGET_EXHAUSTED("retry_budget_exhausted"),
  NOT_YET_ELIGIBLE("not_yet_eligible"),
  IN_PROGRESS("in_progress"),
  CONCURRENT_MODIFICATION("concurrent_modification"),
  PROCESSOR_FAILED("processor_failed");

  private final String code;

  ProcessingOutcome(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }
}

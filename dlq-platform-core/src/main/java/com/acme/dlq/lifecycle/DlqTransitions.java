package com.acme.dlq.lifecycle;

import com.acme.dlq.domain.DlqMessage;
import com.acme.dlq.domain.DlqMessageStatus;
import com.acme.dlq.domain.RetryAttempt;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pure state transition function for DLQ messages: {@code (current, event) -> next}.
 *
 * <p>The input message is never modified; every call returns a fresh copy. Persisting the result is
 * the caller's job. Events that are not legal in the current status throw
 * {@link IllegalStateException}, since the engine checks eligibility before producing them.
 */
public final class DlqTransitions {

  public static final String NOTES_PROCESSED = "processed";
  public static final String NOTES_RETRY_BUDGET_EXHAUSTED = "retry_budget_exhausted";
  public static final String NOTES_EXPIRED = "expired";

  private DlqTransitions() {}

  public static DlqMessage apply(DlqMessage current, DlqEvent event) {
    if (current.getStatus().isTerminal()) {
      throw new IllegalStateException(
          "Message " + current.getId() + " is " + current.getStatus() + "; cannot apply " + event);
    }

    DlqMessage next = current.copy();
    next.setUpdatedAt(event.at());

    if (event instanceof DlqEvent.ProcessingStarted) {
      requireRetryable(current, event);
      next.setStatus(DlqMessageStatus.PROCESSING);
      next.setLastRetryAt(event.at());
    } else if (event instanceof DlqEvent.ProcessingSucceeded) {
      requireStatus(current, event, DlqMessageStatus.PROCESSING);
      next.setStatus(DlqMessageStatus.RESOLVED);
      next.setProcessedAt(event.at());
      next.setResolutionNotes(NOTES_PROCESSED);
    } else if (event instanceof DlqEvent.ProcessingFailed failed) {
      requireStatus(current, event, DlqMessageStatus.PROCESSING);
      applyFailure(next, failed);
    } else if (event instanceof DlqEvent.RetryBudgetExhausted) {
      next.setStatus(DlqMessageStatus.FAILED);
      next.setResolutionNotes(NOTES_RETRY_BUDGET_EXHAUSTED);
    } else if (event instanceof DlqEvent.Expired) {
      requireStatus(current, event, DlqMessageStatus.PENDING);
      next.setStatus(DlqMessageStatus.EXPIRED);
      next.setResolutionNotes(NOTES_EXPIRED);
    } else if (event instanceof DlqEvent.ResolvedByOperator resolved) {
      next.setStatus(DlqMessageStatus.RESOLVED);
      next.setProcessedAt(resolved.at());
      next.setResolvedBy(resolved.resolvedBy());
      next.setResolutionNotes(resolved.notes());
    }
    return next;
  }

  private static void applyFailure(DlqMessage next, DlqEvent.ProcessingFailed failed) {
    int attempt = next.getRetryCount() + 1;

    Map<String, Object> attemptContext = new LinkedHashMap<>();
    attemptContext.put("name", failed.error().name());
    if (failed.error().stack() != null) {
      attemptContext.put("stack", failed.error().stack());
    }
    List<RetryAttempt> history = new ArrayList<>(next.getRetryHistory());
    history.add(new RetryAttempt(attempt, failed.at(), failed.error().message(), attemptContext));

    Map<String, Object> errorContext = new LinkedHashMap<>();
    errorContext.put("name", failed.error().name());
    errorContext.put("lastAttempt", failed.at().toString());

    next.setRetryCount(attempt);
    next.setRetryHistory(history);
    next.setNextRetryAt(failed.nextRetryAt());
    next.setErrorMessage(failed.error().message());
    next.setErrorStack(failed.error().stack());
    next.setErrorContext(errorContext);
    next.setStatus(
        attempt >= next.getMaxRetries() ? DlqMessageStatus.FAILED : DlqMessageStatus.PENDING);
  }

  private static void requireRetryable(DlqMessage current, DlqEvent event) {
    if (current.isRetryBudgetExhausted()) {
      throw new IllegalStateException(
          "Message " + current.getId() + " has exhausted its retry budget; cannot apply " + event);
    }
  }

  private static void requireStatus(
      DlqMessage current, DlqEvent event, DlqMessageStatus expected) {
    if (current.getStatus() != expected) {
      throw new IllegalStateException(
          "Message "
              + current.getId()
              + " is "
              + current.getStatus()
              + ", expected "
              + expected
              + " for "
              + event);
    }
  }
}

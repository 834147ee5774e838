package com.acme.dlq.lifecycle;

import com.acme.dlq.domain.FailureDetails;

import java.time.Instant;

/**
 * Events that move a DLQ message through its lifecycle. Each event carries the instant it happened
 * so transitions stay independent of the wall clock.
 */
public sealed interface DlqEvent {

    Instant at();

    /**
     * A retry attempt was claimed and is about to run
     */
    record ProcessingStarted(Instant at) implements DlqEvent {
    }

    /**
     * The processor completed without error
     */
    record ProcessingSucceeded(Instant at) implements DlqEvent {
    }

    /**
     * The processor failed; {@code nextRetryAt} is computed by the caller from the new attempt number
     */
    record ProcessingFailed(Instant at, FailureDetails error, Instant nextRetryAt) implements DlqEvent {
    }

    /**
     * The retry budget was found exhausted during an eligibility check
     */
    record RetryBudgetExhausted(Instant at) implements DlqEvent {
    }

    /**
     * The expiration sweep found the message past its expiration instant
     */
    record Expired(Instant at) implements DlqEvent {
    }

    /**
     * An operator resolved the message by hand
     */
    record ResolvedByOperator(Instant at, String resolvedBy, String notes) implements DlqEvent {
    }
}

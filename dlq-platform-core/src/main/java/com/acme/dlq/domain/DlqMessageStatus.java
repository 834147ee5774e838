package com.acme.dlq.domain;

/**
 * Lifecycle status of a DLQ message.
 */
public enum DlqMessageStatus {
    /** Waiting for a retry attempt (possibly not before {@code nextRetryAt}). */
    PENDING,

    /** A retry attempt is running. */
    PROCESSING,

    /** Retry budget exhausted; kept for inspection. */
    FAILED,

    /** Processed successfully or resolved by an operator. */
    RESOLVED,

    /** Swept after passing its expiration instant while still pending. */
    EXPIRED;

    /**
     * Terminal statuses are never left by engine-driven transitions.
     */
    public boolean isTerminal() {
        return this == RESOLVED || this == EXPIRED;
    }
}

package com.acme.dlq.domain;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * DLQ message domain entity (pure domain object, no persistence annotations).
 *
 * <p>Holds one failed asynchronous operation together with its retry state. Lifecycle changes go
 * through {@link com.acme.dlq.lifecycle.DlqTransitions}; setters exist for mapping only.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class DlqMessage {

    private UUID id;
    private UUID organizationId;
    private DlqMessageType type;
    private DlqMessageStatus status;
    private String originalMessage;
    private Map<String, Object> messageData;
    private String errorMessage;
    private String errorStack;
    private Map<String, Object> errorContext;
    private int retryCount;
    private int maxRetries;
    private Instant nextRetryAt;
    private Instant lastRetryAt;
    private List<RetryAttempt> retryHistory;
    private String sourceQueue;
    private String sourceSubject;
    private Map<String, Object> metadata;
    private Instant expiresAt;
    private String resolvedBy;
    private String resolutionNotes;
    private Instant createdAt;
    private Instant updatedAt;
    private Instant processedAt;
    private long version;

    /**
     * Create a new PENDING message with an empty retry history.
     */
    public static DlqMessage newPending(
            UUID organizationId,
            DlqMessageType type,
            String originalMessage,
            FailureDetails error,
            Map<String, Object> errorContext,
            int maxRetries,
            Instant expiresAt,
            Instant now) {
        DlqMessage message = new DlqMessage();
        message.id = UUID.randomUUID();
        message.organizationId = organizationId;
        message.type = type;
        message.status = DlqMessageStatus.PENDING;
        message.originalMessage = originalMessage;
        message.errorMessage = error.message();
        message.errorStack = error.stack();
        message.errorContext = errorContext;
        message.retryCount = 0;
        message.maxRetries = maxRetries;
        message.retryHistory = new ArrayList<>();
        message.expiresAt = expiresAt;
        message.createdAt = now;
        message.updatedAt = now;
        message.version = 0L;
        return message;
    }

    public boolean isRetryBudgetExhausted() {
        return retryCount >= maxRetries;
    }

    /** True when no retry delay is pending, i.e. {@code nextRetryAt} is unset or not after now. */
    public boolean isDueForRetry(Instant now) {
        return nextRetryAt == null || !nextRetryAt.isAfter(now);
    }

    public boolean isExpiredAt(Instant now) {
        return expiresAt != null && expiresAt.isBefore(now);
    }

    /**
     * Copy with independent collections, so a transition never mutates the state it was given.
     */
    public DlqMessage copy() {
        return new DlqMessage(
                id,
                organizationId,
                type,
                status,
                originalMessage,
                copyOf(messageData),
                errorMessage,
                errorStack,
                copyOf(errorContext),
                retryCount,
                maxRetries,
                nextRetryAt,
                lastRetryAt,
                retryHistory == null ? new ArrayList<>() : new ArrayList<>(retryHistory),
                sourceQueue,
                sourceSubject,
                copyOf(metadata),
                expiresAt,
                resolvedBy,
                resolutionNotes,
                createdAt,
                updatedAt,
                processedAt,
                version);
    }

    private static Map<String, Object> copyOf(Map<String, Object> map) {
        return map == null ? null : new LinkedHashMap<>(map);
    }
}

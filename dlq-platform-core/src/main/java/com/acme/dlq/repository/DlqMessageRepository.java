package com.acme.dlq.repository;

import com.acme.dlq.domain.DlqMessage;
import com.acme.dlq.domain.DlqMessageStatus;
import com.acme.dlq.domain.DlqMessageType;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Repository for DLQ messages - durable keyed storage with filter, order and count queries.
 *
 * <p>Every update is conditional on the version the caller read (optimistic concurrency). A
 * successful update increments the stored version and the version of the passed message.
 */
public interface DlqMessageRepository {

    // Insert/update/delete operations

    /**
     * Insert a new message with version 0
     */
    void insert(DlqMessage message);

    /**
     * Write all mutable fields of the message if the stored version still equals
     * {@code expectedVersion}.
     *
     * @return true if the row was updated, false if it changed concurrently or no longer exists
     */
    boolean update(DlqMessage message, long expectedVersion);

    /**
     * Delete a message regardless of its status
     *
     * @return true if a row was deleted
     */
    boolean deleteById(UUID id);

    // Query operations

    Optional<DlqMessage> findById(UUID id);

    /**
     * PENDING messages, optionally filtered by organization and type, oldest first
     */
    List<DlqMessage> findPending(UUID organizationId, DlqMessageType type, int limit);

    /**
     * PENDING messages whose next retry time is unset or not after {@code now}, oldest first
     */
    List<DlqMessage> findReadyToRetry(Instant now, int limit);

    /**
     * FAILED messages, optionally filtered by organization and type, most recently retried first
     */
    List<DlqMessage> findFailed(UUID organizationId, DlqMessageType type, int limit);

    /**
     * PENDING messages whose expiration instant is before {@code now}, oldest first
     */
    List<DlqMessage> findExpiredCandidates(Instant now, int limit);

    // Count operations (organizationId may be null for all organizations)

    long countAll(UUID organizationId);

    long countByStatus(DlqMessageStatus status, UUID organizationId);

    /**
     * Message counts grouped by type across all statuses; types without messages are absent
     */
    Map<DlqMessageType, Long> countByType(UUID organizationId);
}

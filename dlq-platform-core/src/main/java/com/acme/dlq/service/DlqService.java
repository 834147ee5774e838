package com.acme.dlq.service;

import com.acme.dlq.domain.DlqMessage;
import com.acme.dlq.domain.DlqMessageType;
import com.acme.dlq.domain.FailureDetails;
import com.acme.dlq.spi.DlqProcessor;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Service for Dead Letter Queue operations: enqueue failed operations, drive their retries, query
 * and sweep them.
 *
 * <p>The service never schedules work itself; an external scheduler decides when to call
 * {@link #processMessage} and {@link #sweepExpired()}.
 */
public interface DlqService {

    /**
     * Record a failed operation as a PENDING message and raise a medium-severity alert. No
     * processing is attempted.
     */
    DlqMessage enqueue(
            UUID organizationId,
            DlqMessageType type,
            String originalMessage,
            FailureDetails error,
            EnqueueContext context);

    /**
     * Attempt one retry of a message with the given processor.
     */
    ProcessingResult processMessage(UUID id, DlqProcessor processor);

    /**
     * Attempt one retry with the processor registered for the message type.
     */
    ProcessingResult processMessage(UUID id);

    /**
     * Drive several messages through their registered processors; never aborts on a single item.
     */
    BatchProcessingResult processBatch(List<UUID> ids);

    Optional<DlqMessage> getById(UUID id);

    List<DlqMessage> listPending(UUID organizationId, DlqMessageType type, int limit);

    List<DlqMessage> listReadyToRetry(int limit);

    List<DlqMessage> listFailed(UUID organizationId, DlqMessageType type, int limit);

    List<DlqMessage> listExpiredCandidates(int limit);

    DlqStats stats(UUID organizationId);

    /**
     * Mark a non-terminal message RESOLVED on behalf of an operator. Terminal messages are returned
     * unchanged.
     */
    Optional<DlqMessage> resolveManually(UUID id, String resolvedBy, String notes);

    /**
     * Delete a message in any status
     */
    boolean delete(UUID id);

    /**
     * Expire PENDING messages past their expiration instant
     *
     * @return number of messages expired
     */
    int sweepExpired();
}

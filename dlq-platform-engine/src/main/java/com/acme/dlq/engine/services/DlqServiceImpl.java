package com.acme.dlq.engine.services;

import com.acme.dlq.config.DlqConfig;
import com.acme.dlq.domain.DlqMessage;
import com.acme.dlq.domain.DlqMessageStatus;
import com.acme.dlq.domain.DlqMessageType;
import com.acme.dlq.domain.FailureDetails;
import com.acme.dlq.lifecycle.DlqEvent;
import com.acme.dlq.lifecycle.DlqTransitions;
import com.acme.dlq.registry.DlqProcessorRegistry;
import com.acme.dlq.repository.DlqMessageRepository;
import com.acme.dlq.retry.BackoffCalculator;
import com.acme.dlq.service.BatchProcessingResult;
import com.acme.dlq.service.DlqService;
import com.acme.dlq.service.DlqStats;
import com.acme.dlq.service.EnqueueContext;
import com.acme.dlq.service.ProcessingResult;
import com.acme.dlq.spi.AlertSeverity;
import com.acme.dlq.spi.AlertSummary;
import com.acme.dlq.spi.AlertingBridge;
import com.acme.dlq.spi.DlqProcessor;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * DLQ engine: enqueues failed operations and drives their retries against the record store.
 *
 * <p>Every write is conditional on the version read just before it, so two callers driving the same
 * message never both run its processor. The processor itself runs outside any store transaction.
 */
@Singleton
public class DlqServiceImpl implements DlqService {
  private static final Logger LOG = LoggerFactory.getLogger(DlqServiceImpl.class);

  private static final int MAX_RESOLVE_ATTEMPTS = 3;

  private final DlqMessageRepository repository;
  private final AlertingBridge alerting;
  private final DlqProcessorRegistry registry;
  private final ProcessorInvoker invoker;
  private final DlqConfig config;
  private final Clock clock;
  private final BackoffCalculator backoff;

  @Inject
  public DlqServiceImpl(
      DlqMessageRepository repository,
      AlertingBridge alerting,
      DlqProcessorRegistry registry,
      ProcessorInvoker invoker,
      DlqConfig config,
      Clock clock) {
    this(
        repository,
        alerting,
        registry,
        invoker,
        config,
        clock,
        new BackoffCalculator(config.toRetryPolicy(), clock));
  }

  public DlqServiceImpl(
      DlqMessageRepository repository,
      AlertingBridge alerting,
      DlqProcessorRegistry registry,
      ProcessorInvoker invoker,
      DlqConfig config,
      Clock clock,
      BackoffCalculator backoff) {
    config.validate();
    this.repository = repository;
    this.alerting = alerting;
    this.registry = registry;
    this.invoker = invoker;
    this.config = config;
    this.clock = clock;
    this.backoff = backoff;
  }

  @Override
  public DlqMessage enqueue(
      UUID organizationId,
      DlqMessageType type,
      String originalMessage,
      FailureDetails error,
      EnqueueContext context) {
    Objects.requireNonNull(organizationId, "organizationId");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(originalMessage, "originalMessage");
    Objects.requireNonNull(error, "error");
    EnqueueContext ctx = context == null ? EnqueueContext.empty() : context;

    Instant now = Instant.now(clock);
    int maxRetries =
        ctx.getMaxRetries() != null ? ctx.getMaxRetries() : config.getDefaultMaxRetries();
    Instant expiresAt =
        ctx.getExpiresAt() != null ? ctx.getExpiresAt() : now.plus(config.getDefaultExpiration());

    Map<String, Object> errorContext = new LinkedHashMap<>();
    errorContext.put("name", error.name());
    errorContext.putAll(ctx.asMap());

    DlqMessage message =
        DlqMessage.newPending(
            organizationId, type, originalMessage, error, errorContext, maxRetries, expiresAt, now);
    message.setMessageData(ctx.getMessageData());
    message.setSourceQueue(ctx.getSourceQueue());
    message.setSourceSubject(ctx.getSourceSubject());
    message.setMetadata(ctx.getMetadata());

    repository.insert(message);
    LOG.info(
        "Message added to DLQ: id={}, type={}, organizationId={}, error={}",
        message.getId(),
        type.code(),
        organizationId,
        error.message());

    raiseEnqueuedAlert(message, error);
    return message;
  }

  @Override
  public ProcessingResult processMessage(UUID id, DlqProcessor processor) {
    Objects.requireNonNull(processor, "processor");
    return drive(id, message -> processor);
  }

  @Override
  public ProcessingResult processMessage(UUID id) {
    return drive(id, this::resolveProcessor);
  }

  @Override
  public BatchProcessingResult processBatch(List<UUID> ids) {
    int processed = 0;
    int failed = 0;
    List<BatchProcessingResult.ItemResult> results = new ArrayList<>(ids.size());

    for (UUID id : ids) {
      try {
        ProcessingResult result = processMessage(id);
        results.add(new BatchProcessingResult.ItemResult(id, result.success(), result.reason()));
        if (result.success()) {
          processed++;
        } else {
          failed++;
        }
      } catch (RuntimeException e) {
        LOG.error("Failed to process DLQ message {} in batch: {}", id, e.getMessage(), e);
        String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        results.add(new BatchProcessingResult.ItemResult(id, false, reason));
        failed++;
      }
    }

    LOG.info("Processed DLQ batch: {} processed, {} failed", processed, failed);
    return new BatchProcessingResult(processed, failed, results);
  }

  @Override
  public Optional<DlqMessage> getById(UUID id) {
    return repository.findById(Objects.requireNonNull(id, "id"));
  }

  @Override
  public List<DlqMessage> listPending(UUID organizationId, DlqMessageType type, int limit) {
    return repository.findPending(organizationId, type, config.clampLimit(limit));
  }

  @Override
  public List<DlqMessage> listReadyToRetry(int limit) {
    return repository.findReadyToRetry(Instant.now(clock), config.clampLimit(limit));
  }

  @Override
  public List<DlqMessage> listFailed(UUID organizationId, DlqMessageType type, int limit) {
    return repository.findFailed(organizationId, type, config.clampLimit(limit));
  }

  @Override
  public List<DlqMessage> listExpiredCandidates(int limit) {
    return repository.findExpiredCandidates(Instant.now(clock), config.clampLimit(limit));
  }

  @Override
  public DlqStats stats(UUID organizationId) {
    return new DlqStats(
        repository.countAll(organizationId),
        repository.countByStatus(DlqMessageStatus.PENDING, organizationId),
        repository.countByStatus(DlqMessageStatus.PROCESSING, organizationId),
        repository.countByStatus(DlqMessageStatus.FAILED, organizationId),
        repository.countByStatus(DlqMessageStatus.RESOLVED, organizationId),
        repository.countByStatus(DlqMessageStatus.EXPIRED, organizationId),
        repository.countByType(organizationId));
  }

  @Override
  public Optional<DlqMessage> resolveManually(UUID id, String resolvedBy, String notes) {
    Objects.requireNonNull(id, "id");

    for (int attempt = 1; attempt <= MAX_RESOLVE_ATTEMPTS; attempt++) {
      Optional<DlqMessage> found = repository.findById(id);
      if (found.isEmpty() || found.get().getStatus().isTerminal()) {
        return found;
      }
      DlqMessage current = found.get();
      DlqMessage resolved =
          DlqTransitions.apply(
              current, new DlqEvent.ResolvedByOperator(Instant.now(clock), resolvedBy, notes));
      if (repository.update(resolved, current.getVersion())) {
        LOG.info("DLQ message {} marked as resolved by {}", id, resolvedBy);
        return Optional.of(resolved);
      }
      LOG.debug("DLQ message {} changed while resolving, re-reading (attempt {})", id, attempt);
    }
    throw new IllegalStateException(
        "DLQ message " + id + " kept changing concurrently; could not mark it resolved");
  }

  @Override
  public boolean delete(UUID id) {
    boolean deleted = repository.deleteById(Objects.requireNonNull(id, "id"));
    if (deleted) {
      LOG.info("DLQ message deleted: {}", id);
    } else {
      LOG.debug("DLQ message {} not found for delete", id);
    }
    return deleted;
  }

  @Override
  public int sweepExpired() {
    Instant now = Instant.now(clock);
    List<DlqMessage> candidates =
        repository.findExpiredCandidates(now, config.getSweepBatchSize());

    int swept = 0;
    for (DlqMessage message : candidates) {
      if (message.getStatus() != DlqMessageStatus.PENDING || !message.isExpiredAt(now)) {
        continue;
      }
      try {
        DlqMessage expired = DlqTransitions.apply(message, new DlqEvent.Expired(now));
        if (repository.update(expired, message.getVersion())) {
          swept++;
        } else {
          LOG.debug("Skipping expiry of DLQ message {}: changed concurrently", message.getId());
        }
      } catch (RuntimeException e) {
        LOG.warn("Failed to expire DLQ message {}: {}", message.getId(), e.getMessage());
      }
    }

    if (swept > 0) {
      LOG.info("Cleaned up {} expired DLQ messages", swept);
    }
    return swept;
  }

  // Retry drive

  private ProcessingResult drive(UUID id, Function<DlqMessage, DlqProcessor> processorFor) {
    Objects.requireNonNull(id, "id");

    Optional<DlqMessage> found = repository.findById(id);
    if (found.isEmpty()) {
      LOG.warn("DLQ message not found: {}", id);
      return ProcessingResult.notFound();
    }
    DlqMessage current = found.get();
    Instant now = Instant.now(clock);

    ProcessingResult ineligible = checkEligibility(current, now);
    if (ineligible != null) {
      return ineligible;
    }

    DlqMessage claimed = DlqTransitions.apply(current, new DlqEvent.ProcessingStarted(now));
    if (!repository.update(claimed, current.getVersion())) {
      LOG.info("Lost claim on DLQ message {}: another caller changed it first", id);
      return ProcessingResult.concurrentModification();
    }

    FailureDetails failure = null;
    try {
      invoker.invoke(processorFor.apply(claimed), claimed.copy());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      failure = FailureDetails.from(e);
    } catch (Exception e) {
      failure = FailureDetails.from(e);
    }

    return failure == null ? recordSuccess(claimed) : recordFailure(claimed, failure);
  }

  /** Outcomes that end the drive before the claim; null when the message may be processed. */
  private ProcessingResult checkEligibility(DlqMessage message, Instant now) {
    DlqMessageStatus status = message.getStatus();
    if (status == DlqMessageStatus.RESOLVED) {
      LOG.info("DLQ message already resolved: {}", message.getId());
      return ProcessingResult.alreadyResolved();
    }
    if (status == DlqMessageStatus.EXPIRED) {
      LOG.warn("DLQ message expired: {}", message.getId());
      return ProcessingResult.expired();
    }
    if (status == DlqMessageStatus.PROCESSING && isLeaseHeld(message, now)) {
      LOG.debug("DLQ message {} is being processed by another caller", message.getId());
      return ProcessingResult.inProgress();
    }
    if (message.isRetryBudgetExhausted()) {
      markRetryBudgetExhausted(message, now);
      return ProcessingResult.retryBudgetExhausted(message.getRetryCount());
    }
    if (!message.isDueForRetry(now)) {
      return ProcessingResult.notYetEligible(message.getNextRetryAt());
    }
    return null;
  }

  private boolean isLeaseHeld(DlqMessage message, Instant now) {
    Instant startedAt = message.getLastRetryAt();
    return startedAt != null && startedAt.plus(config.getProcessingLease()).isAfter(now);
  }

  private void markRetryBudgetExhausted(DlqMessage message, Instant now) {
    LOG.warn(
        "DLQ message exceeded max retries: id={}, retryCount={}, maxRetries={}",
        message.getId(),
        message.getRetryCount(),
        message.getMaxRetries());
    if (message.getStatus() == DlqMessageStatus.FAILED
        && DlqTransitions.NOTES_RETRY_BUDGET_EXHAUSTED.equals(message.getResolutionNotes())) {
      return;
    }
    DlqMessage failed = DlqTransitions.apply(message, new DlqEvent.RetryBudgetExhausted(now));
    if (!repository.update(failed, message.getVersion())) {
      LOG.warn("Could not mark DLQ message {} FAILED: changed concurrently", message.getId());
    }
  }

  private ProcessingResult recordSuccess(DlqMessage claimed) {
    DlqMessage resolved =
        DlqTransitions.apply(claimed, new DlqEvent.ProcessingSucceeded(Instant.now(clock)));
    if (!repository.update(resolved, claimed.getVersion())) {
      LOG.warn(
          "DLQ message {} processed but its result was not saved: changed concurrently",
          claimed.getId());
      return ProcessingResult.concurrentModification();
    }
    LOG.info(
        "DLQ message processed successfully: id={}, type={}, retryCount={}",
        resolved.getId(),
        resolved.getType().code(),
        resolved.getRetryCount());
    return ProcessingResult.processed(resolved.getRetryCount());
  }

  private ProcessingResult recordFailure(DlqMessage claimed, FailureDetails failure) {
    int attempt = claimed.getRetryCount() + 1;
    Instant nextRetryAt = backoff.nextRetryTime(attempt);
    DlqMessage failed =
        DlqTransitions.apply(
            claimed, new DlqEvent.ProcessingFailed(Instant.now(clock), failure, nextRetryAt));
    if (!repository.update(failed, claimed.getVersion())) {
      LOG.warn(
          "DLQ message {} failed but the attempt was not saved: changed concurrently",
          claimed.getId());
      return ProcessingResult.concurrentModification();
    }

    LOG.warn(
        "DLQ message processing failed: id={}, retryCount={}, error={}, nextRetryAt={}",
        failed.getId(),
        failed.getRetryCount(),
        failure.message(),
        failed.getNextRetryAt());

    if (failed.getStatus() == DlqMessageStatus.FAILED) {
      raiseTerminalFailureAlert(failed, failure);
    }
    return ProcessingResult.processorFailed(failed.getRetryCount(), failed.getNextRetryAt());
  }

  private DlqProcessor resolveProcessor(DlqMessage message) {
    return registry
        .find(message.getType())
        .orElseGet(
            () ->
                unregistered -> {
                  throw new IllegalStateException(
                      "No processor registered for message type: " + message.getType().code());
                });
  }

  // Alerts are best effort: a bridge failure never fails the DLQ operation

  private void raiseEnqueuedAlert(DlqMessage message, FailureDetails error) {
    Map<String, Object> tags = new LinkedHashMap<>();
    tags.put("messageType", message.getType().code());
    tags.put("messageId", message.getId().toString());
    tags.put("errorType", error.name());

    Map<String, Object> context = new LinkedHashMap<>();
    context.put("error", error.message());
    context.put("retryCount", message.getRetryCount());
    context.put("maxRetries", message.getMaxRetries());

    AlertSummary summary =
        new AlertSummary(
            "Message Added to Dead Letter Queue",
            "A " + message.getType().code() + " message failed processing and was added to DLQ",
            AlertSummary.SOURCE,
            tags,
            context);
    try {
      alerting.onEnqueued(message.getOrganizationId(), summary, AlertSeverity.MEDIUM);
    } catch (RuntimeException e) {
      LOG.error("Failed to raise DLQ alert for message {}: {}", message.getId(), e.getMessage(), e);
    }
  }

  private void raiseTerminalFailureAlert(DlqMessage message, FailureDetails error) {
    Map<String, Object> tags = new LinkedHashMap<>();
    tags.put("messageType", message.getType().code());
    tags.put("messageId", message.getId().toString());
    tags.put("retryCount", message.getRetryCount());

    Map<String, Object> context = new LinkedHashMap<>();
    context.put("error", error.message());
    context.put("maxRetries", message.getMaxRetries());
    context.put("lastAttempt", message.getLastRetryAt().toString());

    AlertSummary summary =
        new AlertSummary(
            "DLQ Message Failed After Max Retries",
            "A "
                + message.getType().code()
                + " message failed processing after "
                + message.getRetryCount()
                + " attempts",
            AlertSummary.SOURCE,
            tags,
            context);
    try {
      alerting.onTerminalFailure(message.getOrganizationId(), summary, AlertSeverity.HIGH);
    } catch (RuntimeException e) {
      LOG.error("Failed to raise DLQ alert for message {}: {}", message.getId(), e.getMessage(), e);
    }
  }
}

package com.acme.dlq.engine.services;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

import com.acme.dlq.config.DlqConfig;
import com.acme.dlq.domain.DlqMessage;
import com.acme.dlq.domain.DlqMessageStatus;
import com.acme.dlq.domain.DlqMessageType;
import com.acme.dlq.domain.FailureDetails;
import com.acme.dlq.engine.H2EngineTestBase;
import com.acme.dlq.engine.MutableClock;
import com.acme.dlq.persistence.jdbc.H2DlqMessageRepository;
import com.acme.dlq.registry.DlqProcessorRegistry;
import com.acme.dlq.retry.BackoffCalculator;
import com.acme.dlq.service.BatchProcessingResult;
import com.acme.dlq.service.DlqStats;
import com.acme.dlq.service.EnqueueContext;
import com.acme.dlq.service.ProcessingOutcome;
import com.acme.dlq.service.ProcessingResult;
import com.acme.dlq.spi.AlertSeverity;
import com.acme.dlq.spi.AlertSummary;
import com.acme.dlq.spi.AlertingBridge;
import com.acme.dlq.spi.DlqProcessor;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

/**
 * Engine tests against the H2 record store with a controllable clock and a fixed jitter draw.
 */
@DisplayName("DlqServiceImpl Tests")
class DlqServiceImplTest extends H2EngineTestBase {

  private static final Instant T0 = Instant.parse("2025-06-01T10:00:00Z");
  private static final UUID ORG = UUID.randomUUID();
  private static final double JITTER_DRAW = 0.5;

  private MutableClock clock;
  private DlqConfig config;
  private AlertingBridge alerting;
  private DlqProcessorRegistry registry;
  private ProcessorInvoker invoker;
  private DlqServiceImpl service;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(T0);
    config = new DlqConfig();
    alerting = mock(AlertingBridge.class);
    registry = new DlqProcessorRegistry();
    invoker = new ProcessorInvoker(Duration.ofSeconds(5));
    service = newService(invoker);
  }

  @AfterEach
  void closeInvoker() {
    invoker.close();
  }

  private DlqServiceImpl newService(ProcessorInvoker processorInvoker) {
    BackoffCalculator backoff =
        new BackoffCalculator(config.toRetryPolicy(), clock, () -> JITTER_DRAW);
    return new DlqServiceImpl(
        repository, alerting, registry, processorInvoker, config, clock, backoff);
  }

  private DlqMessage enqueue(EnqueueContext context) {
    return service.enqueue(
        ORG,
        DlqMessageType.PUBLISH,
        "{\"postId\":\"p-1\"}",
        FailureDetails.of("PublishError", "upstream rejected"),
        context);
  }

  private DlqMessage reload(DlqMessage message) {
    return repository.findById(message.getId()).orElseThrow();
  }

  private static DlqProcessor failingWith(String error) {
    return message -> {
      throw new IllegalStateException(error);
    };
  }

  @Nested
  @DisplayName("enqueue")
  class EnqueueTests {

    @Test
    @DisplayName("should persist a PENDING message with default retry budget and expiration")
    void testEnqueueDefaults() {
      DlqMessage message = enqueue(EnqueueContext.empty());

      DlqMessage stored = reload(message);
      assertThat(stored.getStatus()).isEqualTo(DlqMessageStatus.PENDING);
      assertThat(stored.getRetryCount()).isZero();
      assertThat(stored.getMaxRetries()).isEqualTo(3);
      assertThat(stored.getExpiresAt()).isEqualTo(T0.plus(Duration.ofDays(7)));
      assertThat(stored.getErrorMessage()).isEqualTo("upstream rejected");
      assertThat(stored.getErrorContext()).containsEntry("name", "PublishError");
      assertThat(stored.getRetryHistory()).isEmpty();
      assertThat(stored.getCreatedAt()).isEqualTo(T0);
    }

    @Test
    @DisplayName("should apply context overrides and merge context into the error context")
    void testEnqueueWithContext() {
      Instant expiresAt = T0.plus(Duration.ofHours(1));
      DlqMessage message =
          enqueue(
              EnqueueContext.empty()
                  .withMaxRetries(5)
                  .withExpiresAt(expiresAt)
                  .withSourceQueue("publishing")
                  .withSourceSubject("post.publish")
                  .withMessageData(Map.of("channel", "linkedin"))
                  .withMetadata(Map.of("requestId", "r-9")));

      DlqMessage stored = reload(message);
      assertThat(stored.getMaxRetries()).isEqualTo(5);
      assertThat(stored.getExpiresAt()).isEqualTo(expiresAt);
      assertThat(stored.getSourceQueue()).isEqualTo("publishing");
      assertThat(stored.getSourceSubject()).isEqualTo("post.publish");
      assertThat(stored.getMessageData()).containsEntry("channel", "linkedin");
      assertThat(stored.getMetadata()).containsEntry("requestId", "r-9");
      assertThat(stored.getErrorContext())
          .containsEntry("name", "PublishError")
          .containsEntry("sourceQueue", "publishing")
          .containsEntry("maxRetries", 5);
    }

    @Test
    @DisplayName("should raise a medium severity alert describing the message")
    void testEnqueueAlert() {
      DlqMessage message = enqueue(EnqueueContext.empty());

      ArgumentCaptor<AlertSummary> summary = ArgumentCaptor.forClass(AlertSummary.class);
      verify(alerting).onEnqueued(eq(ORG), summary.capture(), eq(AlertSeverity.MEDIUM));
      assertThat(summary.getValue().title()).isEqualTo("Message Added to Dead Letter Queue");
      assertThat(summary.getValue().source()).isEqualTo("dlq-service");
      assertThat(summary.getValue().tags())
          .containsEntry("messageType", "publish")
          .containsEntry("messageId", message.getId().toString())
          .containsEntry("errorType", "PublishError");
      assertThat(summary.getValue().context()).containsEntry("maxRetries", 3);
    }

    @Test
    @DisplayName("should keep the message when the alerting bridge fails")
    void testEnqueueAlertFailure() {
      doThrow(new RuntimeException("pager down"))
          .when(alerting)
          .onEnqueued(any(), any(), any());

      DlqMessage message = enqueue(EnqueueContext.empty());

      assertThat(repository.findById(message.getId())).isPresent();
    }

    @Test
    @DisplayName("should reject a missing organization")
    void testEnqueueRequiresOrganization() {
      assertThatThrownBy(
              () ->
                  service.enqueue(
                      null,
                      DlqMessageType.PUBLISH,
                      "{}",
                      FailureDetails.of("Error", "x"),
                      EnqueueContext.empty()))
          .isInstanceOf(NullPointerException.class);
    }
  }

  @Nested
  @DisplayName("processMessage - retry lifecycle")
  class RetryLifecycleTests {

    @Test
    @DisplayName("failing processor should back off and exhaust a budget of two")
    void testFailuresExhaustBudget() {
      DlqMessage message = enqueue(EnqueueContext.empty().withMaxRetries(2));

      ProcessingResult first = service.processMessage(message.getId(), failingWith("boom"));

      assertThat(first.success()).isFalse();
      assertThat(first.outcome()).isEqualTo(ProcessingOutcome.PROCESSOR_FAILED);
      assertThat(first.retryCount()).isEqualTo(1);
      assertThat(first.nextRetryAt()).isBetween(T0.plusMillis(1000), T0.plusMillis(1100));
      DlqMessage afterFirst = reload(message);
      assertThat(afterFirst.getStatus()).isEqualTo(DlqMessageStatus.PENDING);
      assertThat(afterFirst.getRetryCount()).isEqualTo(1);
      assertThat(afterFirst.getLastRetryAt()).isEqualTo(T0);
      assertThat(afterFirst.getRetryHistory()).hasSize(1);
      assertThat(afterFirst.getRetryHistory().get(0).attempt()).isEqualTo(1);
      assertThat(afterFirst.getRetryHistory().get(0).error()).isEqualTo("boom");
      assertThat(afterFirst.getErrorMessage()).isEqualTo("boom");
      assertThat(afterFirst.getErrorContext()).containsEntry("name", "IllegalStateException");

      clock.advance(Duration.ofSeconds(2));
      Instant secondAt = clock.instant();
      ProcessingResult second = service.processMessage(message.getId(), failingWith("boom"));

      assertThat(second.outcome()).isEqualTo(ProcessingOutcome.PROCESSOR_FAILED);
      assertThat(second.retryCount()).isEqualTo(2);
      assertThat(second.nextRetryAt())
          .isBetween(secondAt.plusMillis(2000), secondAt.plusMillis(2200));
      DlqMessage afterSecond = reload(message);
      assertThat(afterSecond.getStatus()).isEqualTo(DlqMessageStatus.FAILED);
      assertThat(afterSecond.getRetryCount()).isEqualTo(afterSecond.getMaxRetries());
      assertThat(afterSecond.getRetryHistory()).extracting(a -> a.attempt()).containsExactly(1, 2);
    }

    @Test
    @DisplayName("terminal failure should raise a high severity alert once")
    void testTerminalFailureAlert() {
      DlqMessage message = enqueue(EnqueueContext.empty().withMaxRetries(1));

      service.processMessage(message.getId(), failingWith("boom"));

      ArgumentCaptor<AlertSummary> summary = ArgumentCaptor.forClass(AlertSummary.class);
      verify(alerting).onTerminalFailure(eq(ORG), summary.capture(), eq(AlertSeverity.HIGH));
      assertThat(summary.getValue().title()).isEqualTo("DLQ Message Failed After Max Retries");
      assertThat(summary.getValue().context()).containsEntry("error", "boom");
    }

    @Test
    @DisplayName("non-terminal failure should not raise a terminal alert")
    void testNonTerminalFailureNoAlert() {
      DlqMessage message = enqueue(EnqueueContext.empty());

      service.processMessage(message.getId(), failingWith("boom"));

      verify(alerting, never()).onTerminalFailure(any(), any(), any());
    }

    @Test
    @DisplayName("exhausted message should be reported without invoking the processor")
    void testRetryBudgetExhausted() {
      DlqMessage message = enqueue(EnqueueContext.empty().withMaxRetries(2));
      service.processMessage(message.getId(), failingWith("boom"));
      clock.advance(Duration.ofSeconds(2));
      service.processMessage(message.getId(), failingWith("boom"));
      clock.advance(Duration.ofSeconds(5));
      AtomicInteger calls = new AtomicInteger();

      ProcessingResult result =
          service.processMessage(message.getId(), m -> calls.incrementAndGet());

      assertThat(result.success()).isFalse();
      assertThat(result.reason()).isEqualTo("retry_budget_exhausted");
      assertThat(result.retryCount()).isEqualTo(2);
      assertThat(calls).hasValue(0);
      DlqMessage stored = reload(message);
      assertThat(stored.getStatus()).isEqualTo(DlqMessageStatus.FAILED);
      assertThat(stored.getResolutionNotes()).isEqualTo("retry_budget_exhausted");
    }

    @Test
    @DisplayName("zero retry budget should fail the message on its first drive")
    void testZeroRetryBudget() {
      DlqMessage message = enqueue(EnqueueContext.empty().withMaxRetries(0));

      ProcessingResult result = service.processMessage(message.getId(), m -> {});

      assertThat(result.outcome()).isEqualTo(ProcessingOutcome.RETRY_BUDGET_EXHAUSTED);
      assertThat(reload(message).getStatus()).isEqualTo(DlqMessageStatus.FAILED);
    }

    @Test
    @DisplayName("successful processor should resolve the message")
    void testSuccess() {
      DlqMessage message = enqueue(EnqueueContext.empty());
      clock.advance(Duration.ofSeconds(3));

      ProcessingResult result = service.processMessage(message.getId(), m -> {});

      assertThat(result.success()).isTrue();
      assertThat(result.reason()).isEqualTo("processed");
      assertThat(result.retryCount()).isZero();
      DlqMessage stored = reload(message);
      assertThat(stored.getStatus()).isEqualTo(DlqMessageStatus.RESOLVED);
      assertThat(stored.getProcessedAt()).isEqualTo(T0.plusSeconds(3));
      assertThat(stored.getResolutionNotes()).isEqualTo("processed");
    }

    @Test
    @DisplayName("processor should see the message as PROCESSING")
    void testProcessorSeesClaimedMessage() {
      DlqMessage message = enqueue(EnqueueContext.empty());
      AtomicInteger sawProcessing = new AtomicInteger();

      service.processMessage(
          message.getId(),
          m -> {
            if (m.getStatus() == DlqMessageStatus.PROCESSING && T0.equals(m.getLastRetryAt())) {
              sawProcessing.incrementAndGet();
            }
          });

      assertThat(sawProcessing).hasValue(1);
    }

    @Test
    @DisplayName("resolved message should stay resolved and never re-run the processor")
    void testIdempotentResolved() {
      DlqMessage message = enqueue(EnqueueContext.empty());
      service.processMessage(message.getId(), m -> {});
      AtomicInteger calls = new AtomicInteger();

      for (int i = 0; i < 3; i++) {
        ProcessingResult result =
            service.processMessage(message.getId(), m -> calls.incrementAndGet());
        assertThat(result.success()).isTrue();
        assertThat(result.reason()).isEqualTo("already_resolved");
      }
      assertThat(calls).hasValue(0);
    }

    @Test
    @DisplayName("message with a future retry time should not be processed yet")
    void testNotYetEligible() {
      DlqMessage message = enqueue(EnqueueContext.empty());
      ProcessingResult failed = service.processMessage(message.getId(), failingWith("boom"));
      AtomicInteger calls = new AtomicInteger();

      ProcessingResult result =
          service.processMessage(message.getId(), m -> calls.incrementAndGet());

      assertThat(result.reason()).isEqualTo("not_yet_eligible");
      assertThat(result.nextRetryAt()).isEqualTo(failed.nextRetryAt());
      assertThat(calls).hasValue(0);
      assertThat(reload(message).getRetryCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("unknown id should report not_found")
    void testNotFound() {
      ProcessingResult result = service.processMessage(UUID.randomUUID(), m -> {});

      assertThat(result.success()).isFalse();
      assertThat(result.outcome()).isEqualTo(ProcessingOutcome.NOT_FOUND);
    }

    @Test
    @DisplayName("expired message should report expired without mutation")
    void testExpired() {
      DlqMessage message = enqueue(EnqueueContext.empty().withExpiresAt(T0.minusMillis(1)));
      service.sweepExpired();
      long version = reload(message).getVersion();

      ProcessingResult result = service.processMessage(message.getId(), m -> {});

      assertThat(result.reason()).isEqualTo("expired");
      assertThat(reload(message).getVersion()).isEqualTo(version);
    }
  }

  @Nested
  @DisplayName("processMessage - concurrency and timeouts")
  class ConcurrencyTests {

    @Test
    @DisplayName("two callers reading the same version should run the processor once")
    void testConcurrentClaimProcessesOnce() throws Exception {
      DlqMessage message = enqueue(EnqueueContext.empty());
      H2DlqMessageRepository racing = spy(repository);
      CyclicBarrier bothRead = new CyclicBarrier(2);
      doAnswer(
              invocation -> {
                Object found = invocation.callRealMethod();
                bothRead.await(5, TimeUnit.SECONDS);
                return found;
              })
          .when(racing)
          .findById(message.getId());
      BackoffCalculator backoff =
          new BackoffCalculator(config.toRetryPolicy(), clock, () -> JITTER_DRAW);
      DlqServiceImpl racingService =
          new DlqServiceImpl(racing, alerting, registry, invoker, config, clock, backoff);
      AtomicInteger calls = new AtomicInteger();
      DlqProcessor processor = m -> calls.incrementAndGet();

      ExecutorService callers = Executors.newFixedThreadPool(2);
      try {
        Future<ProcessingResult> first =
            callers.submit(() -> racingService.processMessage(message.getId(), processor));
        Future<ProcessingResult> second =
            callers.submit(() -> racingService.processMessage(message.getId(), processor));

        List<String> reasons =
            List.of(
                first.get(10, TimeUnit.SECONDS).reason(),
                second.get(10, TimeUnit.SECONDS).reason());

        assertThat(reasons).containsExactlyInAnyOrder("processed", "concurrent_modification");
        assertThat(calls).hasValue(1);
      } finally {
        callers.shutdownNow();
      }

      DlqMessage stored = reload(message);
      assertThat(stored.getStatus()).isEqualTo(DlqMessageStatus.RESOLVED);
      assertThat(stored.getRetryCount()).isZero();
    }

    @Test
    @DisplayName("message claimed by another caller should report in_progress")
    void testInProgress() {
      DlqMessage message = enqueue(EnqueueContext.empty());
      DlqMessage claimed = reload(message);
      claimed.setStatus(DlqMessageStatus.PROCESSING);
      claimed.setLastRetryAt(T0);
      repository.update(claimed, claimed.getVersion());
      clock.advance(Duration.ofMinutes(1));
      AtomicInteger calls = new AtomicInteger();

      ProcessingResult result =
          service.processMessage(message.getId(), m -> calls.incrementAndGet());

      assertThat(result.reason()).isEqualTo("in_progress");
      assertThat(calls).hasValue(0);
    }

    @Test
    @DisplayName("abandoned PROCESSING message should be reclaimed after the lease")
    void testAbandonedClaimReclaimed() {
      DlqMessage message = enqueue(EnqueueContext.empty());
      DlqMessage claimed = reload(message);
      claimed.setStatus(DlqMessageStatus.PROCESSING);
      claimed.setLastRetryAt(T0);
      repository.update(claimed, claimed.getVersion());
      clock.advance(config.getProcessingLease().plusSeconds(1));

      ProcessingResult result = service.processMessage(message.getId(), m -> {});

      assertThat(result.outcome()).isEqualTo(ProcessingOutcome.PROCESSED);
    }

    @Test
    @DisplayName("result should be reported as concurrent_modification when resolved meanwhile")
    void testPostWriteLost() {
      DlqMessage message = enqueue(EnqueueContext.empty());

      ProcessingResult result =
          service.processMessage(
              message.getId(), m -> service.resolveManually(m.getId(), "ops@acme", "fixed by hand"));

      assertThat(result.reason()).isEqualTo("concurrent_modification");
      DlqMessage stored = reload(message);
      assertThat(stored.getStatus()).isEqualTo(DlqMessageStatus.RESOLVED);
      assertThat(stored.getResolvedBy()).isEqualTo("ops@acme");
    }

    @Test
    @DisplayName("processor exceeding the timeout should be interrupted and count as a failure")
    void testTimeout() throws Exception {
      ProcessorInvoker shortInvoker = new ProcessorInvoker(Duration.ofMillis(100));
      DlqServiceImpl timed = newService(shortInvoker);
      DlqMessage message = enqueue(EnqueueContext.empty());
      CountDownLatch interrupted = new CountDownLatch(1);

      try {
        ProcessingResult result =
            timed.processMessage(
                message.getId(),
                m -> {
                  try {
                    Thread.sleep(10_000);
                  } catch (InterruptedException e) {
                    interrupted.countDown();
                    throw e;
                  }
                });

        assertThat(result.outcome()).isEqualTo(ProcessingOutcome.PROCESSOR_FAILED);
        assertThat(result.retryCount()).isEqualTo(1);
        assertThat(interrupted.await(5, TimeUnit.SECONDS)).isTrue();
        DlqMessage stored = reload(message);
        assertThat(stored.getStatus()).isEqualTo(DlqMessageStatus.PENDING);
        assertThat(stored.getErrorContext()).containsEntry("name", "TimeoutException");
      } finally {
        shortInvoker.close();
      }
    }
  }

  @Test
  @DisplayName("should refuse a processing lease no longer than the processor timeout")
  void testRejectsShortLease() {
    config.setProcessorTimeout(Duration.ofMinutes(5));
    config.setProcessingLease(Duration.ofMinutes(5));

    assertThatThrownBy(() -> newService(invoker))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("processingLease");
  }

  @Nested
  @DisplayName("processMessage - registered processors")
  class RegistryTests {

    @Test
    @DisplayName("should use the processor registered for the message type")
    void testRegisteredProcessor() {
      AtomicInteger calls = new AtomicInteger();
      registry.register(DlqMessageType.PUBLISH, m -> calls.incrementAndGet());
      DlqMessage message = enqueue(EnqueueContext.empty());

      ProcessingResult result = service.processMessage(message.getId());

      assertThat(result.outcome()).isEqualTo(ProcessingOutcome.PROCESSED);
      assertThat(calls).hasValue(1);
    }

    @Test
    @DisplayName("unregistered type should consume a retry as a processor failure")
    void testUnregisteredType() {
      DlqMessage message = enqueue(EnqueueContext.empty());

      ProcessingResult result = service.processMessage(message.getId());

      assertThat(result.outcome()).isEqualTo(ProcessingOutcome.PROCESSOR_FAILED);
      assertThat(reload(message).getErrorMessage())
          .isEqualTo("No processor registered for message type: publish");
    }

    @Test
    @DisplayName("batch should drive every id and never abort on a single item")
    void testProcessBatch() {
      registry.register(DlqMessageType.PUBLISH, m -> {});
      DlqMessage first = enqueue(EnqueueContext.empty());
      DlqMessage second = enqueue(EnqueueContext.empty());
      UUID missing = UUID.randomUUID();

      BatchProcessingResult result =
          service.processBatch(List.of(first.getId(), missing, second.getId()));

      assertThat(result.processed()).isEqualTo(2);
      assertThat(result.failed()).isEqualTo(1);
      assertThat(result.results())
          .extracting(BatchProcessingResult.ItemResult::reason)
          .containsExactly("processed", "not_found", "processed");
    }

    @Test
    @DisplayName("batch should capture unexpected errors per item")
    void testProcessBatchCapturesErrors() {
      registry.register(DlqMessageType.PUBLISH, m -> {});
      DlqMessage message = enqueue(EnqueueContext.empty());
      List<UUID> ids = new ArrayList<>();
      ids.add(null);
      ids.add(message.getId());

      BatchProcessingResult result = service.processBatch(ids);

      assertThat(result.processed()).isEqualTo(1);
      assertThat(result.failed()).isEqualTo(1);
      assertThat(result.results().get(0).success()).isFalse();
    }
  }

  @Nested
  @DisplayName("queries, stats and sweep")
  class QueryTests {

    @Test
    @DisplayName("listPending should return oldest first")
    void testListPendingFifo() {
      DlqMessage first = enqueue(EnqueueContext.empty());
      clock.advance(Duration.ofSeconds(1));
      DlqMessage second = enqueue(EnqueueContext.empty());

      assertThat(service.listPending(ORG, DlqMessageType.PUBLISH, 10))
          .extracting(DlqMessage::getId)
          .containsExactly(first.getId(), second.getId());
    }

    @Test
    @DisplayName("listReadyToRetry should skip messages still backing off")
    void testListReadyToRetry() {
      DlqMessage backingOff = enqueue(EnqueueContext.empty());
      service.processMessage(backingOff.getId(), failingWith("boom"));
      DlqMessage fresh = enqueue(EnqueueContext.empty());

      assertThat(service.listReadyToRetry(10))
          .extracting(DlqMessage::getId)
          .containsExactly(fresh.getId());

      clock.advance(Duration.ofSeconds(2));
      assertThat(service.listReadyToRetry(10)).hasSize(2);
    }

    @Test
    @DisplayName("sweep should expire overdue PENDING messages exactly once")
    void testSweepExpired() {
      DlqMessage overdue = enqueue(EnqueueContext.empty().withExpiresAt(T0.minusMillis(1)));
      DlqMessage current = enqueue(EnqueueContext.empty());

      assertThat(service.listExpiredCandidates(10))
          .extracting(DlqMessage::getId)
          .containsExactly(overdue.getId());
      assertThat(service.sweepExpired()).isEqualTo(1);
      assertThat(service.sweepExpired()).isZero();

      DlqMessage stored = reload(overdue);
      assertThat(stored.getStatus()).isEqualTo(DlqMessageStatus.EXPIRED);
      assertThat(stored.getResolutionNotes()).isEqualTo("expired");
      assertThat(service.listPending(ORG, null, 10))
          .extracting(DlqMessage::getId)
          .containsExactly(current.getId());
    }

    @Test
    @DisplayName("listFailed should return exhausted messages")
    void testListFailed() {
      DlqMessage message = enqueue(EnqueueContext.empty().withMaxRetries(1));
      service.processMessage(message.getId(), failingWith("boom"));

      assertThat(service.listFailed(ORG, DlqMessageType.PUBLISH, 10))
          .extracting(DlqMessage::getId)
          .containsExactly(message.getId());
    }

    @Test
    @DisplayName("stats should count per status and per type")
    void testStats() {
      enqueue(EnqueueContext.empty());
      DlqMessage resolved = enqueue(EnqueueContext.empty());
      service.processMessage(resolved.getId(), m -> {});
      DlqMessage failed = enqueue(EnqueueContext.empty().withMaxRetries(1));
      service.processMessage(failed.getId(), failingWith("boom"));
      service.enqueue(
          UUID.randomUUID(),
          DlqMessageType.AUDIT_LOG,
          "{}",
          FailureDetails.of("Error", "x"),
          EnqueueContext.empty());

      DlqStats stats = service.stats(ORG);

      assertThat(stats.total()).isEqualTo(3);
      assertThat(stats.pending()).isEqualTo(1);
      assertThat(stats.processing()).isZero();
      assertThat(stats.resolved()).isEqualTo(1);
      assertThat(stats.failed()).isEqualTo(1);
      assertThat(stats.expired()).isZero();
      assertThat(stats.byType()).containsOnly(Map.entry(DlqMessageType.PUBLISH, 3L));
      assertThat(service.stats(null).total()).isEqualTo(4);
    }

    @Test
    @DisplayName("getById should return the stored message")
    void testGetById() {
      DlqMessage message = enqueue(EnqueueContext.empty());

      assertThat(service.getById(message.getId()))
          .map(DlqMessage::getId)
          .contains(message.getId());
      assertThat(service.getById(UUID.randomUUID())).isEmpty();
    }
  }

  @Nested
  @DisplayName("operator actions")
  class OperatorTests {

    @Test
    @DisplayName("resolveManually should record who resolved the message")
    void testResolveManually() {
      DlqMessage message = enqueue(EnqueueContext.empty());
      clock.advance(Duration.ofMinutes(10));

      DlqMessage resolved =
          service.resolveManually(message.getId(), "ops@acme", "replayed manually").orElseThrow();

      assertThat(resolved.getStatus()).isEqualTo(DlqMessageStatus.RESOLVED);
      DlqMessage stored = reload(message);
      assertThat(stored.getResolvedBy()).isEqualTo("ops@acme");
      assertThat(stored.getResolutionNotes()).isEqualTo("replayed manually");
      assertThat(stored.getProcessedAt()).isEqualTo(T0.plus(Duration.ofMinutes(10)));
    }

    @Test
    @DisplayName("resolveManually should leave terminal messages unchanged")
    void testResolveTerminal() {
      DlqMessage message = enqueue(EnqueueContext.empty().withExpiresAt(T0.minusMillis(1)));
      service.sweepExpired();

      DlqMessage result =
          service.resolveManually(message.getId(), "ops@acme", "too late").orElseThrow();

      assertThat(result.getStatus()).isEqualTo(DlqMessageStatus.EXPIRED);
      assertThat(result.getResolvedBy()).isNull();
    }

    @Test
    @DisplayName("resolveManually should return empty for an unknown id")
    void testResolveMissing() {
      assertThat(service.resolveManually(UUID.randomUUID(), "ops", null)).isEmpty();
    }

    @Test
    @DisplayName("delete should remove a message in any status")
    void testDelete() {
      DlqMessage message = enqueue(EnqueueContext.empty());
      service.processMessage(message.getId(), m -> {});

      assertThat(service.delete(message.getId())).isTrue();
      assertThat(service.getById(message.getId())).isEmpty();
      assertThat(service.delete(message.getId())).isFalse();
    }
  }
}

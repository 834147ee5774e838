package com.acme.dlq.engine.scheduling;

import com.acme.dlq.config.DlqConfig;
import com.acme.dlq.domain.DlqMessage;
import com.acme.dlq.service.DlqService;
import com.acme.dlq.service.ProcessingResult;
import io.micronaut.context.annotation.Requires;
import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.inject.Singleton;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Periodically drives DLQ messages that are due for retry through their registered processors.
 */
@Singleton
@Requires(property = "dlq.scheduler.enabled", value = "true")
public class DlqRetryScheduler {
  private static final Logger LOG = LoggerFactory.getLogger(DlqRetryScheduler.class);

  private final DlqService dlqService;
  private final DlqConfig config;

  public DlqRetryScheduler(DlqService dlqService, DlqConfig config) {
    this.dlqService = dlqService;
    this.config = config;
  }

  @Scheduled(
      fixedDelay = "${dlq.scheduler.retry-interval:30s}",
      initialDelay = "${dlq.scheduler.retry-interval:30s}")
  public void tick() {
    try {
      List<DlqMessage> ready =
          dlqService.listReadyToRetry(config.getScheduler().getRetryBatchSize());
      if (ready.isEmpty()) {
        return;
      }
      LOG.debug("Retrying {} DLQ messages", ready.size());

      int processed = 0;
      for (DlqMessage message : ready) {
        try {
          ProcessingResult result = dlqService.processMessage(message.getId());
          if (result.success()) {
            processed++;
          }
        } catch (Exception e) {
          LOG.warn("Failed to retry DLQ message id={}: {}", message.getId(), e.getMessage());
        }
      }
      LOG.info("DLQ retry tick: {} of {} messages processed", processed, ready.size());
    } catch (Exception e) {
      LOG.error("Error in DlqRetryScheduler tick: {}", e.getMessage(), e);
    }
  }
}

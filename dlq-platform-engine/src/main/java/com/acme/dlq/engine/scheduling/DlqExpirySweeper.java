package com.acme.dlq.engine.scheduling;

import com.acme.dlq.service.DlqService;
import io.micronaut.context.annotation.Requires;
import io.micronaut.scheduling.annotation.Scheduled;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

@Singleton
@Requires(property = "dlq.scheduler.enabled", value = "true")
public class DlqExpirySweeper {
  private static final Logger LOG = LoggerFactory.getLogger(DlqExpirySweeper.class);

  private final DlqService dlqService;

  public DlqExpirySweeper(DlqService dlqService) {
    this.dlqService = dlqService;
  }

  @Scheduled(
      fixedDelay = "${dlq.scheduler.sweep-interval:5m}",
      initialDelay = "${dlq.scheduler.sweep-interval:5m}")
  public void tick() {
    try {
      int swept = dlqService.sweepExpired();
      if (swept > 0) {
        LOG.info("Expired {} DLQ messages", swept);
      }
    } catch (Exception e) {
      LOG.error("Error in DlqExpirySweeper tick: {}", e.getMessage(), e);
    }
  }
}

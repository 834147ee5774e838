package com.acme.dlq.engine.config;

import com.acme.dlq.config.DlqConfig;
import com.acme.dlq.registry.DlqProcessorRegistry;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.annotation.Value;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs the effective DLQ configuration on startup. Disabled in the test environment.
 */
@Singleton
@Requires(notEnv = "test")
public class ConfigurationLogger implements ApplicationEventListener<StartupEvent> {

  private static final Logger LOG = LoggerFactory.getLogger(ConfigurationLogger.class);

  private final DlqConfig config;
  private final DlqProcessorRegistry registry;
  private final String dialect;

  public ConfigurationLogger(
      DlqConfig config,
      DlqProcessorRegistry registry,
      @Value("${db.dialect:unset}") String dialect) {
    this.config = config;
    this.registry = registry;
    this.dialect = dialect;
  }

  @Override
  public void onApplicationEvent(StartupEvent event) {
    LOG.info("━━━ DLQ Configuration ━━━");
    LOG.info("  Database Dialect:   {}", dialect);
    LOG.info("  Max Retries:        {} (default retry budget per message)", config.getDefaultMaxRetries());
    LOG.info("  Expiration:         {} (default time before a PENDING message expires)", config.getDefaultExpiration());
    LOG.info(
        "  Backoff:            base={} max={} multiplier={} jitter={} ({})",
        config.getBaseDelay(),
        config.getMaxDelay(),
        config.getBackoffMultiplier(),
        config.getJitterFraction(),
        config.isJitterEnabled() ? "enabled" : "disabled");
    LOG.info(
        "  Processor Timeout:  {} (0s = unbounded), threads={}",
        config.getProcessorTimeout(),
        config.getProcessorThreads());
    LOG.info("  Processing Lease:   {} (PROCESSING older than this may be reclaimed)", config.getProcessingLease());
    LOG.info("  Query Limit:        default={} max={}", config.getDefaultQueryLimit(), config.getMaxQueryLimit());
    LOG.info("  Sweep Batch Size:   {}", config.getSweepBatchSize());

    DlqConfig.Scheduler scheduler = config.getScheduler();
    if (scheduler.isEnabled()) {
      LOG.info(
          "  Scheduler:          ENABLED (retry every {} x{}, sweep every {})",
          scheduler.getRetryInterval(),
          scheduler.getRetryBatchSize(),
          scheduler.getSweepInterval());
    } else {
      LOG.info("  Scheduler:          DISABLED (external caller drives retries)");
    }
    LOG.info("  Processors:         {}", registry.registeredTypes());
  }
}

package com.acme.dlq.engine.alert;

import com.acme.dlq.spi.AlertSeverity;
import com.acme.dlq.spi.AlertSummary;
import com.acme.dlq.spi.AlertingBridge;
import io.micronaut.context.annotation.Secondary;
import jakarta.inject.Singleton;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default alerting bridge: writes alerts to the log. Any other AlertingBridge bean replaces it.
 */
@Singleton
@Secondary
public class LoggingAlertingBridge implements AlertingBridge {
  private static final Logger LOG = LoggerFactory.getLogger(LoggingAlertingBridge.class);

  @Override
  public void onEnqueued(UUID organizationId, AlertSummary summary, AlertSeverity severity) {
    log(organizationId, summary, severity);
  }

  @Override
  public void onTerminalFailure(UUID organizationId, AlertSummary summary, AlertSeverity severity) {
    log(organizationId, summary, severity);
  }

  private void log(UUID organizationId, AlertSummary summary, AlertSeverity severity) {
    String line = "[{}] {} org={} source={}: {} tags={} context={}";
    Object[] args = {
      severity,
      summary.title(),
      organizationId,
      summary.source(),
      summary.message(),
      summary.tags(),
      summary.context()
    };
    if (severity == AlertSeverity.HIGH || severity == AlertSeverity.CRITICAL) {
      LOG.error(line, args);
    } else {
      LOG.warn(line, args);
    }
  }
}

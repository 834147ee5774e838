package com.acme.dlq.spi;

import java.util.Map;

/**
 * Provider-neutral alert content handed to the alerting bridge.
 */
public record AlertSummary(
    String title,
    String message,
    String source,
    Map<String, Object> tags,
    Map<String, Object> context) {

  public static final String SOURCE = "dlq-service";

  public AlertSummary {
    tags = tags == null ? Map.of() : Map.copyOf(tags);
    context = context == null ? Map.of() : Map.copyOf(context);
  }
}

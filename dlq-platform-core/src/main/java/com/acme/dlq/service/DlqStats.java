package com.acme.dlq.service;

import com.acme.dlq.domain.DlqMessageType;
import java.util.Map;

/**
 * Point-in-time DLQ counts. {@code byType} groups all statuses together.
 */
public record DlqStats(
    long total,
    long pending,
    long processing,
    long failed,
    long resolved,
    long expired,
    Map<DlqMessageType, Long> byType) {

  public DlqStats {
    byType = byType == null ? Map.of() : Map.copyOf(byType);
  }
}

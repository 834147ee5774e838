package com.acme.dlq.service;

import java.util.List;
import java.util.UUID;

/**
 * Outcome of driving several messages in one call.
 */
public record BatchProcessingResult(int processed, int failed, List<ItemResult> results) {

  public BatchProcessingResult {
    results = List.copyOf(results);
  }

  public record ItemResult(UUID messageId, boolean success, String reason) {}
}

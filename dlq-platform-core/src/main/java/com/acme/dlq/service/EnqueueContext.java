package com.acme.dlq.service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Optional enqueue settings. Unset values fall back to the engine defaults (3 retries, expiry 7
 * days after creation).
 */
public class EnqueueContext {

  private Map<String, Object> messageData;
  private String sourceQueue;
  private String sourceSubject;
  private Map<String, Object> metadata;
  private Integer maxRetries;
  private Instant expiresAt;

  public static EnqueueContext empty() {
    return new EnqueueContext();
  }

  public EnqueueContext withMessageData(Map<String, Object> messageData) {
    this.messageData = messageData;
    return this;
  }

  public EnqueueContext withSourceQueue(String sourceQueue) {
    this.sourceQueue = sourceQueue;
    return this;
  }

  public EnqueueContext withSourceSubject(String sourceSubject) {
    this.sourceSubject = sourceSubject;
    return this;
  }

  public EnqueueContext withMetadata(Map<String, Object> metadata) {
    this.metadata = metadata;
    return this;
  }

  public EnqueueContext withMaxRetries(int maxRetries) {
    if (maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0: " + maxRetries);
    }
    this.maxRetries = maxRetries;
    return this;
  }

  public EnqueueContext withExpiresAt(Instant expiresAt) {
    this.expiresAt = expiresAt;
    return this;
  }

  public Map<String, Object> getMessageData() {
    return messageData;
  }

  public String getSourceQueue() {
    return sourceQueue;
  }

  public String getSourceSubject() {
    return sourceSubject;
  }

  public Map<String, Object> getMetadata() {
    return metadata;
  }

  public Integer getMaxRetries() {
    return maxRetries;
  }

  public Instant getExpiresAt() {
    return expiresAt;
  }

  /** Non-null context fields, as recorded in the message's error context. */
  public Map<String, Object> asMap() {
    Map<String, Object> map = new LinkedHashMap<>();
    if (messageData != null) {
      map.put("messageData", messageData);
    }
    if (sourceQueue != null) {
      map.put("sourceQueue", sourceQueue);
    }
    if (sourceSubject != null) {
      map.put("sourceSubject", sourceSubject);
    }
    if (metadata != null) {
      map.put("metadata", metadata);
    }
    if (maxRetries != null) {
      map.put("maxRetries", maxRetries);
    }
    if (expiresAt != null) {
      map.put("expiresAt", expiresAt.toString());
    }
    return map;
  }
}

package com.acme.dlq.registry;

import com.acme.dlq.domain.DlqMessageType;
import com.acme.dlq.spi.DlqProcessor;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registry for DLQ processors - maps message types to the processor that retries them. Pure POJO -
 * no framework dependencies.
 */
public class DlqProcessorRegistry {
  private static final Logger log = LoggerFactory.getLogger(DlqProcessorRegistry.class);

  private final Map<DlqMessageType, DlqProcessor> processors =
      Collections.synchronizedMap(new EnumMap<>(DlqMessageType.class));

  /**
   * Register a processor for a message type
   *
   * @throws IllegalStateException if a processor is already registered for this type
   */
  public void register(DlqMessageType type, DlqProcessor processor) {
    if (type == null || processor == null) {
      throw new IllegalArgumentException("type and processor must not be null");
    }
    if (processors.putIfAbsent(type, processor) != null) {
      String error = "Processor already registered for message type: " + type.code();
      log.error(error);
      throw new IllegalStateException(error);
    }
    log.info("Registered DLQ processor for message type: {}", type.code());
  }

  public Optional<DlqProcessor> find(DlqMessageType type) {
    return Optional.ofNullable(processors.get(type));
  }

  public Set<DlqMessageType> registeredTypes() {
    synchronized (processors) {
      return Set.copyOf(processors.keySet());
    }
  }
}

package com.acme.dlq.engine;

import io.micronaut.runtime.Micronaut;

/**
 * DLQ Engine Application - hosts the DLQ service and, when dlq.scheduler.enabled is set, the
 * scheduled retry and expiry drivers.
 */
public class DlqEngineApplication {
  public static void main(String[] args) {
    Micronaut.run(DlqEngineApplication.class, args);
  }
}

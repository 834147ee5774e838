package com.acme.dlq.engine.config;

import com.acme.dlq.config.DlqConfig;
import com.acme.dlq.engine.services.ProcessorInvoker;
import com.acme.dlq.registry.DlqProcessorRegistry;
import io.micronaut.context.annotation.Bean;
import io.micronaut.context.annotation.ConfigurationProperties;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;
import java.time.Clock;

/**
 * Factory for core DLQ beans.
 *
 * <p>The core module stays free of framework dependencies; this factory wires its POJOs into
 * Micronaut.
 */
@Factory
public class CoreBeansFactory {

  /** Creates DlqConfig bean populated from application.yml dlq.* properties */
  @Singleton
  @ConfigurationProperties("dlq")
  public DlqConfig dlqConfig() {
    return new DlqConfig();
  }

  /** Creates the processor registry; applications register their processors at startup */
  @Singleton
  public DlqProcessorRegistry dlqProcessorRegistry() {
    return new DlqProcessorRegistry();
  }

  @Singleton
  public Clock clock() {
    return Clock.systemUTC();
  }

  /**
   * Creates the processor invoker bounded by dlq.processor-timeout and dlq.processor-threads. The
   * executor is shut down when the context closes.
   */
  @Singleton
  @Bean(preDestroy = "close")
  public ProcessorInvoker processorInvoker(DlqConfig dlqConfig) {
    return new ProcessorInvoker(dlqConfig.getProcessorTimeout(), dlqConfig.getProcessorThreads());
  }
}

package com.acme.dlq.engine.services;

import com.acme.dlq.domain.DlqMessage;
import com.acme.dlq.spi.DlqProcessor;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a processor with a time limit. On timeout the processor thread is interrupted and a
 * {@link TimeoutException} is thrown to the caller. A zero or negative timeout runs the processor on
 * the calling thread without a limit.
 *
 * <p>At most {@code maxThreads} processors run at once; further calls wait for a free thread and the
 * wait counts against their timeout. A processor that ignores interruption keeps its thread until it
 * returns.
 */
public class ProcessorInvoker implements AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(ProcessorInvoker.class);

  private final Duration timeout;
  private final ExecutorService executor;

  public static final int DEFAULT_MAX_THREADS = 16;

  public ProcessorInvoker(Duration timeout) {
    this(timeout, DEFAULT_MAX_THREADS);
  }

  public ProcessorInvoker(Duration timeout, int maxThreads) {
    if (maxThreads < 1) {
      throw new IllegalArgumentException("maxThreads must be >= 1: " + maxThreads);
    }
    this.timeout = timeout == null ? Duration.ZERO : timeout;
    this.executor = Executors.newFixedThreadPool(maxThreads, new ProcessorThreadFactory());
  }

  public Duration timeout() {
    return timeout;
  }

  /**
   * Invoke the processor, rethrowing whatever it throws.
   *
   * @throws TimeoutException if the processor did not finish within the timeout
   */
  public void invoke(DlqProcessor processor, DlqMessage message) throws Exception {
    if (timeout.isZero() || timeout.isNegative()) {
      processor.process(message);
      return;
    }

    Future<?> future =
        executor.submit(
            () -> {
              processor.process(message);
              return null;
            });
    try {
      future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      LOG.warn("Processor for DLQ message {} timed out after {}", message.getId(), timeout);
      throw new TimeoutException("Processor timed out after " + timeout.toMillis() + "ms");
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw e;
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof Exception exception) {
        throw exception;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw e;
    }
  }

  @Override
  public void close() {
    LOG.info("Shutting down DLQ processor executor");
    executor.shutdownNow();
  }

  private static final class ProcessorThreadFactory implements ThreadFactory {
    private final AtomicInteger counter = new AtomicInteger();

    @Override
    public Thread newThread(Runnable runnable) {
      Thread thread = new Thread(runnable, "dlq-processor-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    }
  }
}

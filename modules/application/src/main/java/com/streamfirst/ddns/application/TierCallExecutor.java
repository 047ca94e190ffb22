package com.streamfirst.ddns.application;

import com.streamfirst.ddns.ports.LedgerUnavailableException;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs tier calls on a bounded pool and gives up on them after a fixed timeout. A timed-out call
 * is cancelled and surfaces as {@link TierTimeoutException}; the call's own runtime exceptions
 * surface unchanged.
 */
@Slf4j
public class TierCallExecutor implements AutoCloseable {

  private final ExecutorService executor;
  private final Duration timeout;

  public TierCallExecutor(Duration timeout, int threads) {
    this.timeout = timeout;
    AtomicInteger counter = new AtomicInteger();
    this.executor =
        Executors.newFixedThreadPool(
            threads,
            r -> {
              Thread thread = new Thread(r, "ddns-tier-call-" + counter.incrementAndGet());
              thread.setDaemon(true);
              return thread;
            });
  }

  /** Executor that calls inline, without a time bound. */
  public static TierCallExecutor unbounded() {
    return new TierCallExecutor(Duration.ZERO, 1);
  }

  public <T> T call(String tier, Supplier<T> call) {
    if (timeout.isZero() || timeout.isNegative()) {
      return call.get();
    }
    Future<T> future = executor.submit(call::get);
    try {
      return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      throw new TierTimeoutException(tier, timeout);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException runtime) {
        throw runtime;
      }
      if (cause instanceof Error error) {
        throw error;
      }
      throw new LedgerUnavailableException(tier + " tier call failed", cause);
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new LedgerUnavailableException("Interrupted while waiting for " + tier + " tier", e);
    }
  }

  @Override
  public void close() {
    log.debug("Shutting down tier call executor");
    executor.shutdownNow();
  }
}

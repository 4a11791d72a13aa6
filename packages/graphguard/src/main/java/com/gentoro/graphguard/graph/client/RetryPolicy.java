package com.gentoro.graphguard.graph.client;

import com.gentoro.graphguard.exception.CancelledException;
import com.gentoro.graphguard.exception.NetworkException;
import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Bounded exponential backoff for transient remote failures.
 *
 * <p>Only {@link NetworkException} is retried; every other exception propagates on the first
 * attempt. The delay doubles after each failed attempt, starting at {@code initialDelay} and capped
 * at {@code maxDelay}. When all attempts fail, the last {@link NetworkException} is rethrown.
 */
public final class RetryPolicy {
  private static final org.slf4j.Logger log =
      com.gentoro.graphguard.logging.LoggingService.getLogger(RetryPolicy.class);

  /** Blocks the calling thread between attempts. */
  @FunctionalInterface
  public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
  }

  private final int maxAttempts;
  private final Duration initialDelay;
  private final Duration maxDelay;
  private final Sleeper sleeper;

  public RetryPolicy(int maxAttempts, Duration initialDelay, Duration maxDelay) {
    this(maxAttempts, initialDelay, maxDelay, d -> Thread.sleep(d.toMillis()));
  }

  public RetryPolicy(int maxAttempts, Duration initialDelay, Duration maxDelay, Sleeper sleeper) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be at least 1");
    }
    this.maxAttempts = maxAttempts;
    this.initialDelay = Objects.requireNonNull(initialDelay, "initialDelay");
    this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay");
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }

  public <T> T execute(String operation, Supplier<T> call) {
    Duration delay = initialDelay;
    for (int attempt = 1; ; attempt++) {
      try {
        return call.get();
      } catch (NetworkException e) {
        if (attempt >= maxAttempts) {
          log.warn("{} failed after {} attempts: {}", operation, attempt, e.getMessage());
          throw e;
        }
        log.warn(
            "{} failed (attempt {}/{}), retrying in {} ms: {}",
            operation,
            attempt,
            maxAttempts,
            delay.toMillis(),
            e.getMessage());
        pause(operation, delay);
        delay = next(delay);
      }
    }
  }

  public void run(String operation, Runnable call) {
    execute(
        operation,
        () -> {
          call.run();
          return null;
        });
  }

  private void pause(String operation, Duration delay) {
    try {
      sleeper.sleep(delay);
    } catch (InterruptedException ie) {
      Thread.currentThread().interrupt();
      throw new CancelledException("Interrupted while waiting to retry " + operation, ie);
    }
  }

  private Duration next(Duration delay) {
    Duration doubled = delay.multipliedBy(2);
    return doubled.compareTo(maxDelay) > 0 ? maxDelay : doubled;
  }
}

package com.streamfirst.shush.application;

import com.streamfirst.shush.ports.RegistryException;
import com.streamfirst.shush.ports.RegistryUnavailableException;
import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/** Runs registry calls under a {@link RetryPolicy}, retrying only retryable failures. */
@Slf4j
public class Retrier {

  /** Pause between attempts; replaced in tests to avoid real sleeping. */
  @FunctionalInterface
  public interface Sleeper {
    void sleep(Duration duration) throws InterruptedException;
  }

  private final RetryPolicy policy;
  private final Sleeper sleeper;
  private final DoubleSupplier jitter;

  public Retrier(RetryPolicy policy) {
    this(
        policy,
        duration -> Thread.sleep(duration.toMillis()),
        () -> ThreadLocalRandom.current().nextDouble());
  }

  public Retrier(RetryPolicy policy, Sleeper sleeper, DoubleSupplier jitter) {
    this.policy = policy;
    this.sleeper = sleeper;
    this.jitter = jitter;
  }

  public <T> T call(String description, Supplier<T> action) {
    int attempt = 1;
    while (true) {
      try {
        return action.get();
      } catch (RegistryException e) {
        if (!e.isRetryable() || attempt >= policy.maxAttempts()) {
          if (e.isRetryable()) {
            log.warn("{} failed after {} attempts: {}", description, attempt, e.getMessage());
          }
          throw e;
        }
        Duration delay = policy.backoff(attempt, jitter.getAsDouble());
        log.debug(
            "{} failed (attempt {}/{}), retrying in {} ms: {}",
            description,
            attempt,
            policy.maxAttempts(),
            delay.toMillis(),
            e.getMessage());
        pause(description, delay, e);
        attempt++;
      }
    }
  }

  public void run(String description, Runnable action) {
    call(
        description,
        () -> {
          action.run();
          return null;
        });
  }

  private void pause(String description, Duration delay, RegistryException cause) {
    try {
      sleeper.sleep(delay);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      RegistryUnavailableException interrupted =
          new RegistryUnavailableException(description + " interrupted while retrying", e);
      interrupted.addSuppressed(cause);
      throw interrupted;
    }
  }
}

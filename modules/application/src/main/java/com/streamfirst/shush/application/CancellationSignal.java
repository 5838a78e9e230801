package com.streamfirst.shush.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative stop flag for an invocation. It trips when {@link #cancel()} is called
 * (for example from a shutdown hook) or once the optional deadline has passed.
 * Operations already talking to the registry are allowed to finish.
 */
public final class CancellationSignal {

  private final AtomicBoolean cancelled = new AtomicBoolean();
  private final Clock clock;
  private final Instant deadline;

  private CancellationSignal(Clock clock, Instant deadline) {
    this.clock = clock;
    this.deadline = deadline;
  }

  public static CancellationSignal none() {
    return new CancellationSignal(Clock.systemUTC(), null);
  }

  public static CancellationSignal withDeadline(Duration timeout, Clock clock) {
    return new CancellationSignal(clock, clock.instant().plus(timeout));
  }

  public void cancel() {
    cancelled.set(true);
  }

  public boolean isCancelled() {
    return cancelled.get() || isPastDeadline();
  }

  public Optional<Instant> getDeadline() {
    return Optional.ofNullable(deadline);
  }

  private boolean isPastDeadline() {
    return deadline != null && !clock.instant().isBefore(deadline);
  }
}

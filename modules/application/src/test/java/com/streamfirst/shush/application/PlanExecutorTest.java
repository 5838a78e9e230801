package com.streamfirst.shush.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import com.streamfirst.shush.adapters.InMemorySilenceRegistryAdapter;
import com.streamfirst.shush.domain.Expiration;
import com.streamfirst.shush.domain.FailureKind;
import com.streamfirst.shush.domain.SilenceFilter;
import com.streamfirst.shush.domain.SilenceRecord;
import com.streamfirst.shush.domain.Subject;
import com.streamfirst.shush.domain.Target;
import com.streamfirst.shush.ports.RegistryUnavailableException;
import com.streamfirst.shush.ports.SilenceRegistryPort;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class PlanExecutorTest {

  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
  private static final Clock CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);

  private static final Target A = Target.allChecks(Subject.client("a"));
  private static final Target B = Target.allChecks(Subject.client("b"));
  private static final Target C = Target.allChecks(Subject.client("c"));

  private final InMemorySilenceRegistryAdapter registry = new InMemorySilenceRegistryAdapter(CLOCK);

  private static SilenceRecord record(Target target, String reason) {
    return SilenceRecord.build(target, Expiration.parse("10m", false), reason, "ops", NOW);
  }

  private static OperationPlan createAll(Target... targets) {
    return new OperationPlan(
        PlanAction.SILENCE,
        List.of(targets).stream()
            .map(target -> PlannedOperation.create(record(target, "maintenance"), false))
            .toList());
  }

  @Test
  void oneUnavailableTargetDoesNotStopTheOthers() {
    registry.failAlways(B, () -> new RegistryUnavailableException("connection refused"));
    OperationPlan plan =
        new OperationPlan(
            PlanAction.SILENCE,
            List.of(
                PlannedOperation.create(record(A, "maintenance"), false),
                PlannedOperation.create(record(B, "maintenance"), false),
                PlannedOperation.skip(C, "already silenced")));

    ExecutionReport report = new PlanExecutor(2).execute(plan, registry, CancellationSignal.none());

    assertThat(report.getOutcomes())
        .extracting(TargetOutcome::getTarget, TargetOutcome::getStatus)
        .containsExactly(
            tuple(A, TargetOutcome.Status.SUCCEEDED),
            tuple(B, TargetOutcome.Status.FAILED),
            tuple(C, TargetOutcome.Status.SKIPPED));
    assertThat(report.getOutcomes().get(1).getFailureKind()).contains(FailureKind.UNAVAILABLE);
    assertThat(report.hasFailures()).isTrue();
    assertThat(registry.get(A)).isPresent();
    assertThat(registry.get(B)).isEmpty();
  }

  @Test
  void conflictingCreateIsReportedAsConflict() {
    registry.put(record(A, "deploy"));

    ExecutionReport report =
        new PlanExecutor().execute(createAll(A), registry, CancellationSignal.none());

    assertThat(report.getOutcomes())
        .singleElement()
        .satisfies(
            outcome -> {
              assertThat(outcome.getStatus()).isEqualTo(TargetOutcome.Status.FAILED);
              assertThat(outcome.getFailureKind()).contains(FailureKind.CONFLICT);
            });
    assertThat(registry.get(A).flatMap(SilenceRecord::getReason)).contains("deploy");
  }

  @Test
  void replaceOverwritesConflictingSilence() {
    registry.put(record(A, "deploy"));
    OperationPlan plan =
        new OperationPlan(
            PlanAction.SILENCE, List.of(PlannedOperation.create(record(A, "maintenance"), true)));

    ExecutionReport report = new PlanExecutor().execute(plan, registry, CancellationSignal.none());

    assertThat(report.succeeded()).isEqualTo(1);
    assertThat(registry.get(A).flatMap(SilenceRecord::getReason)).contains("maintenance");
  }

  @Test
  void cancelledSignalLeavesEveryWriteUnattempted() {
    CancellationSignal signal = CancellationSignal.none();
    signal.cancel();

    ExecutionReport report = new PlanExecutor().execute(createAll(A, B, C), registry, signal);

    assertThat(report.failed()).isEqualTo(3);
    assertThat(report.wasCancelled()).isTrue();
    assertThat(registry.callCount()).isZero();
  }

  @Test
  void cancellationDuringExecutionStopsRemainingOperations() {
    CancellationSignal signal = CancellationSignal.none();
    SilenceRegistryPort cancellingRegistry =
        new SilenceRegistryPort() {
          @Override
          public Set<SilenceRecord> list(SilenceFilter filter) {
            return registry.list(filter);
          }

          @Override
          public void create(SilenceRecord record, boolean replaceExisting) {
            registry.create(record, replaceExisting);
            signal.cancel();
          }

          @Override
          public void delete(Target target) {
            registry.delete(target);
          }
        };

    ExecutionReport report =
        new PlanExecutor(1).execute(createAll(A, B, C), cancellingRegistry, signal);

    assertThat(report.succeeded()).isEqualTo(1);
    assertThat(report.withStatus(TargetOutcome.Status.FAILED))
        .hasSize(2)
        .allSatisfy(o -> assertThat(o.getFailureKind()).contains(FailureKind.CANCELLED));
    assertThat(registry.createCount()).isEqualTo(1);
  }

  @Test
  void pastDeadlineCancelsBeforeDispatch() {
    CancellationSignal signal = CancellationSignal.withDeadline(Duration.ZERO, CLOCK);

    ExecutionReport report = new PlanExecutor().execute(createAll(A), registry, signal);

    assertThat(report.wasCancelled()).isTrue();
  }

  @Test
  void unexpectedExceptionsBecomeUnexpectedFailures() {
    SilenceRegistryPort broken =
        new SilenceRegistryPort() {
          @Override
          public Set<SilenceRecord> list(SilenceFilter filter) {
            return Set.of();
          }

          @Override
          public void create(SilenceRecord record, boolean replaceExisting) {
            throw new IllegalStateException("boom");
          }

          @Override
          public void delete(Target target) {}
        };

    ExecutionReport report =
        new PlanExecutor().execute(createAll(B), broken, CancellationSignal.none());

    assertThat(report.getOutcomes().get(0).getFailureKind()).contains(FailureKind.UNEXPECTED);
  }

  @Test
  void neverExceedsConfiguredConcurrency() {
    AtomicInteger inFlight = new AtomicInteger();
    AtomicInteger maxSeen = new AtomicInteger();
    SilenceRegistryPort slow =
        new SilenceRegistryPort() {
          @Override
          public Set<SilenceRecord> list(SilenceFilter filter) {
            return Set.of();
          }

          @Override
          public void create(SilenceRecord record, boolean replaceExisting) {
            int current = inFlight.incrementAndGet();
            maxSeen.accumulateAndGet(current, Math::max);
            try {
              Thread.sleep(20);
            } catch (InterruptedException e) {
              Thread.currentThread().interrupt();
            }
            inFlight.decrementAndGet();
          }

          @Override
          public void delete(Target target) {}
        };
    Target[] targets =
        IntStream.range(0, 8)
            .mapToObj(i -> Target.allChecks(Subject.client("host-" + i)))
            .toArray(Target[]::new);

    ExecutionReport report =
        new PlanExecutor(2).execute(createAll(targets), slow, CancellationSignal.none());

    assertThat(report.succeeded()).isEqualTo(8);
    assertThat(maxSeen.get()).isLessThanOrEqualTo(2);
  }
}

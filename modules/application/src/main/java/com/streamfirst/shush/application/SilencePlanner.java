package com.streamfirst.shush.application;

import com.streamfirst.shush.domain.SilenceRecord;
import com.streamfirst.shush.domain.Target;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.BinaryOperator;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;

/**
 * Reconciles requested targets against the silences currently in the registry and
 * computes the minimal set of writes.
 *
 * <p>Planning is pure: it reads the snapshot of current silences it is handed and
 * returns a plan, nothing is written. Expired records in that snapshot are treated as
 * absent. Targets are deduplicated and processed in sorted order, so no target is
 * ever planned twice.
 */
@Slf4j
public class SilencePlanner {

  /** Sensu reports remaining lifetimes in whole seconds. */
  public static final Duration DEFAULT_TTL_TOLERANCE = Duration.ofSeconds(1);

  static final String ALREADY_SILENCED = "already silenced";
  static final String NOT_SILENCED = "not silenced";
  static final String DIFFERENT_SETTINGS = "silenced with different settings";

  private final Duration ttlTolerance;

  public SilencePlanner() {
    this(DEFAULT_TTL_TOLERANCE);
  }

  public SilencePlanner(Duration ttlTolerance) {
    if (ttlTolerance.isNegative()) {
      throw new IllegalArgumentException("ttl tolerance cannot be negative");
    }
    this.ttlTolerance = ttlTolerance;
  }

  /**
   * Plans the given action. {@link PlanAction#LIST} never writes and yields an empty
   * plan; use {@link #list} for its output.
   */
  public OperationPlan plan(
      PlanAction action,
      Collection<Target> targets,
      Collection<SilenceRecord> current,
      SilenceRequest request,
      Instant now) {
    return switch (action) {
      case SILENCE -> planSilence(targets, current, request, now);
      case CLEAR -> planClear(targets, current, now);
      case LIST -> OperationPlan.empty(PlanAction.LIST);
    };
  }

  public OperationPlan planSilence(
      Collection<Target> targets,
      Collection<SilenceRecord> current,
      SilenceRequest request,
      Instant now) {
    Map<Target, SilenceRecord> live = live(current, now);
    List<PlannedOperation> operations = new ArrayList<>();

    for (Target target : new TreeSet<>(targets)) {
      SilenceRecord desired = request.toRecord(target, now);
      SilenceRecord existing = live.get(target);

      if (existing == null) {
        operations.add(PlannedOperation.create(desired, false));
      } else if (existing.sameIntent(desired, ttlTolerance)) {
        operations.add(PlannedOperation.skip(target, ALREADY_SILENCED));
      } else {
        log.debug("{} is already silenced with different settings: {}", target, existing);
        operations.add(
            switch (request.getConflictPolicy()) {
              case FAIL -> PlannedOperation.create(desired, false);
              case OVERWRITE -> PlannedOperation.create(desired, true);
              case SKIP -> PlannedOperation.skip(target, DIFFERENT_SETTINGS);
            });
      }
    }
    return new OperationPlan(PlanAction.SILENCE, operations);
  }

  public OperationPlan planClear(
      Collection<Target> targets, Collection<SilenceRecord> current, Instant now) {
    Map<Target, SilenceRecord> live = live(current, now);
    List<PlannedOperation> operations = new ArrayList<>();

    for (Target target : new TreeSet<>(targets)) {
      SilenceRecord existing = live.get(target);
      operations.add(
          existing != null
              ? PlannedOperation.delete(existing)
              : PlannedOperation.skip(target, NOT_SILENCED));
    }
    return new OperationPlan(PlanAction.CLEAR, operations);
  }

  /**
   * Returns the unexpired silences whose target is among {@code targets}, or all
   * unexpired silences when no targets are given, sorted by target.
   */
  public List<SilenceRecord> list(
      Collection<Target> targets, Collection<SilenceRecord> current, Instant now) {
    Set<Target> wanted = new TreeSet<>(targets);
    return current.stream()
        .filter(record -> !record.isExpiredAt(now))
        .filter(record -> wanted.isEmpty() || wanted.contains(record.getTarget()))
        .sorted(Comparator.comparing(SilenceRecord::getTarget))
        .toList();
  }

  private static Map<Target, SilenceRecord> live(Collection<SilenceRecord> current, Instant now) {
    BinaryOperator<SilenceRecord> newest =
        (a, b) -> a.getCreatedAt().isAfter(b.getCreatedAt()) ? a : b;
    return current.stream()
        .filter(record -> !record.isExpiredAt(now))
        .collect(Collectors.toMap(SilenceRecord::getTarget, record -> record, newest));
  }
}

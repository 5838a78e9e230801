package com.streamfirst.shush.application;

import com.streamfirst.shush.domain.InventorySnapshot;
import com.streamfirst.shush.domain.SilenceFilter;
import com.streamfirst.shush.domain.SilenceRecord;
import com.streamfirst.shush.domain.Target;
import com.streamfirst.shush.ports.InventoryPort;
import com.streamfirst.shush.ports.SilenceRegistryPort;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs one resolve, plan and execute cycle against a registry. Selector and request
 * validation happens before any I/O, and resolution errors abort before anything is
 * written.
 */
@Slf4j
@RequiredArgsConstructor
public class SilenceService {

  private final SilenceRegistryPort registry;
  private final InventoryPort inventory;
  private final TargetResolver resolver;
  private final SilencePlanner planner;
  private final PlanExecutor executor;
  private final Clock clock;

  /** Computes the silence plan without writing anything. */
  public OperationPlan planSilence(
      SelectorSet selectors, ResolutionOptions options, SilenceRequest request) {
    selectors.validate();
    request.validate();
    SortedSet<Target> targets = resolve(selectors, options);
    Set<SilenceRecord> current = registry.list(SilenceFilter.all());
    return planner.planSilence(targets, current, request, clock.instant());
  }

  /**
   * Silences every target the selectors resolve to.
   *
   * @return per-target outcomes; failed targets do not abort the others
   */
  public ExecutionReport silence(
      SelectorSet selectors,
      ResolutionOptions options,
      SilenceRequest request,
      CancellationSignal signal) {
    OperationPlan plan = planSilence(selectors, options, request);
    return execute(plan, signal);
  }

  /** Computes the clear plan without writing anything. */
  public OperationPlan planClear(SelectorSet selectors, ResolutionOptions options) {
    selectors.validate();
    SortedSet<Target> targets = resolve(selectors, options);
    Set<SilenceRecord> current = registry.list(SilenceFilter.all());
    return planner.planClear(targets, current, clock.instant());
  }

  public ExecutionReport clear(
      SelectorSet selectors, ResolutionOptions options, CancellationSignal signal) {
    OperationPlan plan = planClear(selectors, options);
    return execute(plan, signal);
  }

  /** Lists unexpired silences matching the filter, sorted by target. */
  public List<SilenceRecord> list(SilenceFilter filter) {
    return planner.list(List.of(), registry.list(filter), clock.instant());
  }

  /** Lists unexpired silences on exactly the targets the selectors resolve to. */
  public List<SilenceRecord> list(SelectorSet selectors, ResolutionOptions options) {
    selectors.validate();
    SortedSet<Target> targets = resolve(selectors, options);
    return planner.list(targets, registry.list(SilenceFilter.all()), clock.instant());
  }

  private SortedSet<Target> resolve(SelectorSet selectors, ResolutionOptions options) {
    Instant now = clock.instant();
    InventorySnapshot snapshot =
        selectors.needsInventory(options) ? inventory.snapshot() : InventorySnapshot.empty(now);
    return resolver.resolve(selectors, snapshot, options);
  }

  private ExecutionReport execute(OperationPlan plan, CancellationSignal signal) {
    log.debug("Executing {} plan with {} operations", plan.action(), plan.operations().size());
    ExecutionReport report = executor.execute(plan, registry, signal);
    log.info(
        "{} finished: {} succeeded, {} skipped, {} failed",
        plan.action(),
        report.succeeded(),
        report.skipped(),
        report.failed());
    return report;
  }
}

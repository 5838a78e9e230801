package com.streamfirst.shush.application;

import com.streamfirst.shush.domain.FailureKind;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import lombok.Value;

/**
 * Per-target outcomes of one executed plan, sorted by target. Every operation of the
 * plan has exactly one outcome, including the ones that were never attempted.
 */
@Value
public class ExecutionReport {

  PlanAction action;
  List<TargetOutcome> outcomes;

  public ExecutionReport(PlanAction action, Collection<TargetOutcome> outcomes) {
    this.action = action;
    this.outcomes =
        outcomes.stream().sorted(Comparator.comparing(TargetOutcome::getTarget)).toList();
  }

  public List<TargetOutcome> withStatus(TargetOutcome.Status status) {
    return outcomes.stream().filter(o -> o.getStatus() == status).toList();
  }

  public long count(TargetOutcome.Status status) {
    return outcomes.stream().filter(o -> o.getStatus() == status).count();
  }

  public long succeeded() {
    return count(TargetOutcome.Status.SUCCEEDED);
  }

  public long skipped() {
    return count(TargetOutcome.Status.SKIPPED);
  }

  public long failed() {
    return count(TargetOutcome.Status.FAILED);
  }

  public boolean hasFailures() {
    return outcomes.stream().anyMatch(TargetOutcome::isFailed);
  }

  /** Whether any operation was left unattempted because of cancellation. */
  public boolean wasCancelled() {
    return outcomes.stream()
        .anyMatch(o -> o.getFailureKind().filter(FailureKind.CANCELLED::equals).isPresent());
  }
}

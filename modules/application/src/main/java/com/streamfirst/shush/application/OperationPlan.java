package com.streamfirst.shush.application;

import java.util.List;
import java.util.Objects;

/**
 * Ordered registry operations computed for one invocation. Building a plan does no
 * I/O, so it can be shown as a dry run or inspected in tests before execution.
 *
 * @param action the user action the plan serves
 * @param operations one operation per target, in target order
 */
public record OperationPlan(PlanAction action, List<PlannedOperation> operations) {

  public OperationPlan {
    Objects.requireNonNull(action, "Plan action cannot be null");
    operations = List.copyOf(operations);
  }

  public static OperationPlan empty(PlanAction action) {
    return new OperationPlan(action, List.of());
  }

  public List<PlannedOperation> operations(PlannedOperation.Action kind) {
    return operations.stream().filter(op -> op.getAction() == kind).toList();
  }

  public List<PlannedOperation> writes() {
    return operations.stream().filter(PlannedOperation::isWrite).toList();
  }

  public boolean isEmpty() {
    return operations.isEmpty();
  }
}

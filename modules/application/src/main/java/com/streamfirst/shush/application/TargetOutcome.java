package com.streamfirst.shush.application;

import com.streamfirst.shush.domain.FailureKind;
import com.streamfirst.shush.domain.Target;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

/** Result of applying one planned operation to one target. */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TargetOutcome {

  public enum Status {
    SUCCEEDED,
    SKIPPED,
    FAILED
  }

  @NonNull Target target;
  @NonNull Status status;
  @NonNull String detail;
  FailureKind failureKind;

  public static TargetOutcome succeeded(Target target, String detail) {
    return new TargetOutcome(target, Status.SUCCEEDED, detail, null);
  }

  public static TargetOutcome skipped(Target target, String reason) {
    return new TargetOutcome(target, Status.SKIPPED, reason, null);
  }

  public static TargetOutcome failed(Target target, FailureKind kind, String detail) {
    return new TargetOutcome(target, Status.FAILED, detail, kind);
  }

  public static TargetOutcome cancelled(Target target) {
    return failed(target, FailureKind.CANCELLED, "not attempted, cancelled");
  }

  public Optional<FailureKind> getFailureKind() {
    return Optional.ofNullable(failureKind);
  }

  public boolean isFailed() {
    return status == Status.FAILED;
  }
}

package com.streamfirst.shush.application;

import com.streamfirst.shush.domain.SilenceRecord;
import com.streamfirst.shush.domain.Target;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NonNull;
import lombok.Value;

/** One step of an {@link OperationPlan}. */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PlannedOperation {

  public enum Action {
    CREATE,
    DELETE,
    SKIP
  }

  @NonNull Action action;
  @NonNull Target target;
  SilenceRecord record;
  String skipReason;
  boolean replaceExisting;

  public static PlannedOperation create(SilenceRecord record, boolean replaceExisting) {
    return new PlannedOperation(Action.CREATE, record.getTarget(), record, null, replaceExisting);
  }

  public static PlannedOperation delete(SilenceRecord existing) {
    return new PlannedOperation(Action.DELETE, existing.getTarget(), existing, null, false);
  }

  public static PlannedOperation skip(Target target, String reason) {
    return new PlannedOperation(Action.SKIP, target, null, reason, false);
  }

  /** The record to write for CREATE, the record being removed for DELETE. */
  public Optional<SilenceRecord> getRecord() {
    return Optional.ofNullable(record);
  }

  public Optional<String> getSkipReason() {
    return Optional.ofNullable(skipReason);
  }

  public boolean isWrite() {
    return action != Action.SKIP;
  }
}

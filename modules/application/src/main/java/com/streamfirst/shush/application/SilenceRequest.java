package com.streamfirst.shush.application;

import com.streamfirst.shush.domain.Expiration;
import com.streamfirst.shush.domain.SilenceRecord;
import com.streamfirst.shush.domain.Target;
import com.streamfirst.shush.domain.ValidationException;
import java.time.Instant;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/** Settings shared by every silence written in one invocation. */
@Value
@Builder(toBuilder = true)
public class SilenceRequest {

  @NonNull Expiration expiration;
  String reason;
  @NonNull String creator;
  @NonNull @Builder.Default ConflictPolicy conflictPolicy = ConflictPolicy.FAIL;

  /**
   * @throws ValidationException if the expiration or creator is unusable
   */
  public SilenceRequest validate() {
    expiration.validate();
    if (creator.isBlank()) {
      throw new ValidationException("Silence creator cannot be blank");
    }
    return this;
  }

  public SilenceRecord toRecord(Target target, Instant now) {
    return SilenceRecord.build(target, expiration, reason, creator, now);
  }
}

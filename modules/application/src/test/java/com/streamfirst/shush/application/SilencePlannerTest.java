package com.streamfirst.shush.application;

import static org.assertj.core.api.Assertions.assertThat;

import com.streamfirst.shush.domain.Expiration;
import com.streamfirst.shush.domain.SilenceRecord;
import com.streamfirst.shush.domain.Subject;
import com.streamfirst.shush.domain.Target;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;

class SilencePlannerTest {

  private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");
  private static final Target WEB = Target.allChecks(Subject.client("web-01"));
  private static final Target DB = Target.allChecks(Subject.client("db-01"));

  private final SilencePlanner planner = new SilencePlanner();

  private static SilenceRequest request(String ttl, String reason, ConflictPolicy policy) {
    return SilenceRequest.builder()
        .expiration(Expiration.parse(ttl, false))
        .reason(reason)
        .creator("ops")
        .conflictPolicy(policy)
        .build();
  }

  private static SilenceRecord existing(Target target, String ttl, String reason, Instant createdAt) {
    return SilenceRecord.build(target, Expiration.parse(ttl, false), reason, "ops", createdAt);
  }

  @Test
  void createsWhenNothingIsSilenced() {
    OperationPlan plan =
        planner.planSilence(
            List.of(WEB, DB), List.of(), request("10m", "maintenance", ConflictPolicy.FAIL), NOW);

    assertThat(plan.operations())
        .extracting(PlannedOperation::getAction)
        .containsOnly(PlannedOperation.Action.CREATE);
    assertThat(plan.operations()).extracting(PlannedOperation::getTarget).containsExactly(DB, WEB);
    assertThat(plan.operations().get(0).getRecord())
        .hasValueSatisfying(
            record -> {
              assertThat(record.getExpiresAt()).contains(NOW.plus(Duration.ofMinutes(10)));
              assertThat(record.getReason()).contains("maintenance");
            });
  }

  @Test
  void skipsTargetsAlreadySilencedWithSameIntent() {
    SilenceRecord current = existing(WEB, "10m", "maintenance", NOW.minusSeconds(30));

    OperationPlan plan =
        planner.planSilence(
            List.of(WEB), List.of(current), request("10m", "maintenance", ConflictPolicy.FAIL), NOW);

    assertThat(plan.operations()).singleElement().satisfies(op -> {
      assertThat(op.getAction()).isEqualTo(PlannedOperation.Action.SKIP);
      assertThat(op.getSkipReason()).contains("already silenced");
    });
    assertThat(plan.writes()).isEmpty();
  }

  @Test
  void conflictPolicyDecidesWhatHappensToDifferentSilences() {
    SilenceRecord current = existing(WEB, "1h", "deploy", NOW.minusSeconds(30));

    PlannedOperation fail =
        planner
            .planSilence(List.of(WEB), List.of(current), request("10m", "x", ConflictPolicy.FAIL), NOW)
            .operations()
            .get(0);
    PlannedOperation overwrite =
        planner
            .planSilence(
                List.of(WEB), List.of(current), request("10m", "x", ConflictPolicy.OVERWRITE), NOW)
            .operations()
            .get(0);
    PlannedOperation skip =
        planner
            .planSilence(List.of(WEB), List.of(current), request("10m", "x", ConflictPolicy.SKIP), NOW)
            .operations()
            .get(0);

    assertThat(fail.getAction()).isEqualTo(PlannedOperation.Action.CREATE);
    assertThat(fail.isReplaceExisting()).isFalse();
    assertThat(overwrite.getAction()).isEqualTo(PlannedOperation.Action.CREATE);
    assertThat(overwrite.isReplaceExisting()).isTrue();
    assertThat(skip.getAction()).isEqualTo(PlannedOperation.Action.SKIP);
    assertThat(skip.getSkipReason()).contains("silenced with different settings");
  }

  @Test
  void expiredRecordsAreTreatedAsAbsent() {
    SilenceRecord expired = existing(WEB, "10m", "maintenance", NOW.minus(Duration.ofHours(1)));

    OperationPlan silence =
        planner.planSilence(
            List.of(WEB), List.of(expired), request("10m", "maintenance", ConflictPolicy.FAIL), NOW);
    OperationPlan clear = planner.planClear(List.of(WEB), List.of(expired), NOW);

    assertThat(silence.operations().get(0).getAction()).isEqualTo(PlannedOperation.Action.CREATE);
    assertThat(clear.operations().get(0).getAction()).isEqualTo(PlannedOperation.Action.SKIP);
    assertThat(planner.list(List.of(), List.of(expired), NOW)).isEmpty();
  }

  @Test
  void clearDeletesOnlyWhatExists() {
    SilenceRecord current = existing(DB, "10m", null, NOW);

    OperationPlan plan = planner.planClear(List.of(WEB, DB), List.of(current), NOW);

    assertThat(plan.operations(PlannedOperation.Action.DELETE))
        .extracting(PlannedOperation::getTarget)
        .containsExactly(DB);
    assertThat(plan.operations(PlannedOperation.Action.SKIP))
        .singleElement()
        .satisfies(op -> assertThat(op.getSkipReason()).contains("not silenced"));
  }

  @Test
  void listFiltersByTargetsAndSorts() {
    SilenceRecord web = existing(WEB, "10m", null, NOW);
    SilenceRecord db = existing(DB, "10m", null, NOW);
    SilenceRecord other = existing(Target.of(Subject.ALL, "ntp"), "10m", null, NOW);

    assertThat(planner.list(List.of(WEB, DB), List.of(web, other, db), NOW)).containsExactly(db, web);
    assertThat(planner.list(List.of(), List.of(web, other, db), NOW)).containsExactly(db, web, other);
  }

  @Test
  void listActionPlansNothing() {
    OperationPlan plan = planner.plan(PlanAction.LIST, List.of(WEB), List.of(), null, NOW);

    assertThat(plan.isEmpty()).isTrue();
    assertThat(plan.action()).isEqualTo(PlanAction.LIST);
  }
}

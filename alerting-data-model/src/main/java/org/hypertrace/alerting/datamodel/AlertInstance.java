package org.hypertrace.alerting.datamodel;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** Persisted state row, unique per (ruleOrgId, ruleUid, labelsHash). */
@Value
@Builder(toBuilder = true)
public class AlertInstance {
  long ruleOrgId;
  String ruleUid;
  Labels labels;
  String labelsHash;
  EvalState currentState;
  Instant currentStateSince;
  Instant currentStateEnd;
  Instant lastEvalTime;

  public static AlertInstance from(SaveAlertInstanceCommand cmd) {
    return AlertInstance.builder()
        .ruleOrgId(cmd.getRuleOrgId())
        .ruleUid(cmd.getRuleUid())
        .labels(cmd.getLabels())
        .labelsHash(cmd.getLabels().fingerprint())
        .currentState(cmd.getState())
        .currentStateSince(cmd.getCurrentStateSince())
        .currentStateEnd(cmd.getCurrentStateEnd())
        .lastEvalTime(cmd.getLastEvalTime())
        .build();
  }
}

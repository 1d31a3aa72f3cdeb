package org.hypertrace.alerting.datamodel;

import java.time.Instant;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SaveAlertInstanceCommand {
  long ruleOrgId;
  String ruleUid;
  Labels labels;
  EvalState state;
  Instant lastEvalTime;
  Instant currentStateSince;
  Instant currentStateEnd;
}

package org.hypertrace.alerting.datamodel;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Definition of an alert rule. A rule is never modified while it is being evaluated; definition
 * updates replace the whole object.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class AlertRule {
  long id;
  long orgId;
  String uid;
  String title;
  String namespaceUid;
  String ruleGroup;
  String dashboardUid;
  Long panelId;
  long version;
  Instant updated;
  long intervalSeconds;
  String condition;
  @Builder.Default List<AlertQuery> data = List.of();

  @JsonProperty("for")
  @Builder.Default
  Duration forDuration = Duration.ZERO;

  @Builder.Default NoDataState noDataState = NoDataState.NO_DATA;
  @Builder.Default ExecutionErrorState execErrState = ExecutionErrorState.ALERTING;
  @Builder.Default Map<String, String> labels = Map.of();
  @Builder.Default Map<String, String> annotations = Map.of();

  @JsonIgnore
  public Condition getConditionModel() {
    return new Condition(condition, orgId, data);
  }

  @JsonIgnore
  public AlertRuleKey getKey() {
    return new AlertRuleKey(orgId, uid);
  }
}

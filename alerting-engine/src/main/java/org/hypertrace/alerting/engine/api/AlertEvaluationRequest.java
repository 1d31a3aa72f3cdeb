package org.hypertrace.alerting.engine.api;

import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.hypertrace.alerting.datamodel.AlertRule;

@Value
@Builder
@Jacksonized
public class AlertEvaluationRequest {
  AlertRule alertRule;
  Instant evalTime;
  // forwarded to the data sources queried for this evaluation
  @Builder.Default Map<String, String> queryHeaders = Map.of();
}

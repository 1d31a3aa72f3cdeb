package org.hypertrace.alerting.engine.api;

import java.util.List;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import org.hypertrace.alerting.datamodel.AlertRule;

@Value
@Builder
@Jacksonized
public class AlertProcessRequest {
  AlertRule alertRule;
  @Builder.Default List<ApiEvalResult> evaluationResults = List.of();
}

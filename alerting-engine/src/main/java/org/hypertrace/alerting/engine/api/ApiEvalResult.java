package org.hypertrace.alerting.engine.api;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Evaluation result as exchanged with API clients; {@code state} is the numeric state code. */
@Value
@Builder
@Jacksonized
public class ApiEvalResult {
  @Builder.Default Map<String, String> instance = Map.of();
  Integer state;
  String stateName;
  Instant evaluatedAt;
  Duration evaluationDuration;
  String evaluationString;
  @Builder.Default Map<String, ApiNumberValueCapture> values = Map.of();
  ApiEvalError error;
}

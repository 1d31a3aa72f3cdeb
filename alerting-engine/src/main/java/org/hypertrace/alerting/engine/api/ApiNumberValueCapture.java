package org.hypertrace.alerting.engine.api;

import java.util.Map;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ApiNumberValueCapture {
  String var;
  @Builder.Default Map<String, String> labels = Map.of();
  Double value;
}

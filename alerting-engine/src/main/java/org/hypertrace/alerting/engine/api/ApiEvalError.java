package org.hypertrace.alerting.engine.api;

import java.util.Map;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ApiEvalError {
  public static final String REF_ID_METADATA = "REF_ID";

  ApiErrorType type;
  String message;
  @Builder.Default Map<String, String> metadata = Map.of();
}

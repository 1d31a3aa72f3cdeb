package org.hypertrace.alerting.engine.api;

import java.util.Map;
import lombok.Value;

/** Status code and JSON-serializable body of an API call. */
@Value
public class ApiResponse {
  int status;
  Object body;

  public static ApiResponse ok(Object body) {
    return new ApiResponse(200, body);
  }

  public static ApiResponse badRequest(String message) {
    return new ApiResponse(400, Map.of("message", message));
  }

  public static ApiResponse error(String message) {
    return new ApiResponse(500, Map.of("message", message));
  }
}

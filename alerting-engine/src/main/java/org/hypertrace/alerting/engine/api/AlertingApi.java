package org.hypertrace.alerting.engine.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.hypertrace.alerting.notification.transport.ObjectMapperProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Binds raw JSON request bodies to {@link AlertingService} calls and serializes responses. */
public class AlertingApi {
  private static final Logger LOGGER = LoggerFactory.getLogger(AlertingApi.class);
  static final String BAD_REQUEST_MESSAGE = "bad request data";

  private final AlertingService alertingService;
  private final ObjectMapper objectMapper;

  public AlertingApi(AlertingService alertingService) {
    this.alertingService = alertingService;
    this.objectMapper =
        ObjectMapperProvider.get()
            .copy()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
  }

  public ApiResponse evaluate(String requestBody) {
    AlertEvaluationRequest request;
    try {
      request = objectMapper.readValue(requestBody, AlertEvaluationRequest.class);
    } catch (JsonProcessingException | IllegalArgumentException e) {
      LOGGER.debug("Failed to bind evaluate request", e);
      return ApiResponse.badRequest(BAD_REQUEST_MESSAGE);
    }
    return alertingService.routeEvaluateAlert(request);
  }

  public ApiResponse process(String requestBody) {
    AlertProcessRequest request;
    try {
      request = objectMapper.readValue(requestBody, AlertProcessRequest.class);
    } catch (JsonProcessingException | IllegalArgumentException e) {
      LOGGER.debug("Failed to bind process request", e);
      return ApiResponse.badRequest(BAD_REQUEST_MESSAGE);
    }
    return alertingService.routeProcessAlert(request);
  }

  public String toJson(ApiResponse response) throws JsonProcessingException {
    return objectMapper.writeValueAsString(response.getBody());
  }
}

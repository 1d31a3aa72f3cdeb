package org.hypertrace.alerting.notification.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.google.common.base.Preconditions;
import java.io.IOException;
import java.util.Map;
import org.hypertrace.alerting.notification.transport.http.HttpWithJsonSender;
import org.hypertrace.alerting.notification.transport.http.HttpWithJsonSender.HttpResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Serializes alerts and posts them to an alertmanager's v2 alerts endpoint. */
public class AlertmanagerSender {
  private static final Logger LOGGER = LoggerFactory.getLogger(AlertmanagerSender.class);
  private static final String ALERTS_PATH = "/api/v2/alerts";

  private final HttpWithJsonSender sender;

  public AlertmanagerSender(HttpWithJsonSender sender) {
    this.sender = sender;
  }

  public void send(String baseUrl, Map<String, String> headers, Object alerts)
      throws NotificationTransportException {
    Preconditions.checkArgument(baseUrl != null, "alertmanager url is required");
    String jsonString;
    try {
      jsonString = ObjectMapperProvider.get().writeValueAsString(alerts);
    } catch (JsonProcessingException e) {
      throw new NotificationTransportException("failed to serialize alerts", e);
    }

    String url = alertsUrl(baseUrl);
    HttpResult result;
    try {
      result = sender.send(url, headers, jsonString);
    } catch (IOException e) {
      throw new NotificationTransportException(
          String.format("failed to send alerts to %s: %s", url, e.getMessage()), e);
    }
    if (!result.isSuccessful()) {
      LOGGER.error(
          "Error response from alertmanager when sending alerts. "
              + "Response Code: {}, Response Body: {}",
          result.getCode(),
          result.getBody());
      throw new NotificationTransportException(
          String.format(
              "alertmanager %s responded with status %d: %s",
              url, result.getCode(), result.getBody()),
          result.getCode());
    }
  }

  static String alertsUrl(String baseUrl) {
    String trimmed = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    return trimmed + ALERTS_PATH;
  }
}

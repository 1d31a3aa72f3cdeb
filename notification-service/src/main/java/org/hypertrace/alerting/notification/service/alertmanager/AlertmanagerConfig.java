package org.hypertrace.alerting.notification.service.alertmanager;

import java.util.Map;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class AlertmanagerConfig {
  long orgId;
  String url;
  @Builder.Default Map<String, String> headers = Map.of();
}

package org.hypertrace.alerting.evaluator.datasource;

import java.util.Map;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DataSource {
  String uid;
  String type;
  String url;
  @Builder.Default Map<String, String> headers = Map.of();
}

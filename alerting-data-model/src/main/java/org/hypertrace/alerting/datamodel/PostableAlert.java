package org.hypertrace.alerting.datamodel;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Alert in the shape the alertmanager accepts on its alerts endpoint. */
@Value
@Builder
@Jacksonized
public class PostableAlert {
  Map<String, String> labels;
  Map<String, String> annotations;
  Instant startsAt;
  Instant endsAt;

  @JsonProperty("generatorURL")
  String generatorUrl;
}

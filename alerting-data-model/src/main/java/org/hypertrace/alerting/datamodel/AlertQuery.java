package org.hypertrace.alerting.datamodel;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.time.Duration;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** A single node of a rule's condition graph: either a data source query or an expression. */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class AlertQuery {
  public static final String EXPRESSION_DATASOURCE_UID = "__expr__";

  String refId;
  String datasourceUid;
  String queryType;
  @Builder.Default RelativeTimeRange relativeTimeRange = RelativeTimeRange.DEFAULT;
  @Builder.Default JsonNode model = JsonNodeFactory.instance.objectNode();

  public boolean isExpression() {
    return EXPRESSION_DATASOURCE_UID.equals(datasourceUid);
  }

  /** Window looked back from the evaluation instant, e.g. from=10m to=0 is the last ten minutes. */
  @Value
  @Builder
  @Jacksonized
  public static class RelativeTimeRange {
    public static final RelativeTimeRange DEFAULT =
        RelativeTimeRange.builder().from(Duration.ofMinutes(10)).to(Duration.ZERO).build();

    Duration from;
    Duration to;

    public Instant start(Instant evalTime) {
      return evalTime.minus(from);
    }

    public Instant end(Instant evalTime) {
      return evalTime.minus(to);
    }
  }
}

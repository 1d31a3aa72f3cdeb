package org.hypertrace.alerting.datamodel;

import java.util.List;
import lombok.Value;

@Value
public class Condition {
  // ref id of the query or expression whose output decides the result state
  String condition;
  long orgId;
  List<AlertQuery> data;
}

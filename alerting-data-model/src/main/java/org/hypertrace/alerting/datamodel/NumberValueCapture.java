package org.hypertrace.alerting.datamodel;

import lombok.Value;

/** Number captured for one variable (ref id) while evaluating one instance. */
@Value
public class NumberValueCapture {
  String var;
  Labels labels;
  // null when the variable produced no number for the instance
  Double value;
}

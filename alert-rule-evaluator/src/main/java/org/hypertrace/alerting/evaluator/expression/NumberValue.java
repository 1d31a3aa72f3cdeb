package org.hypertrace.alerting.evaluator.expression;

import lombok.Value;
import org.hypertrace.alerting.datamodel.Labels;

@Value
public class NumberValue {
  Labels labels;
  Double value;
}

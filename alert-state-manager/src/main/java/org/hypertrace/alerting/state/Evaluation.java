package org.hypertrace.alerting.state;

import java.time.Instant;
import java.util.Map;
import lombok.Value;
import org.hypertrace.alerting.datamodel.EvalState;
import org.hypertrace.alerting.datamodel.NumberValueCapture;

/** One past evaluation of an alert instance. */
@Value
public class Evaluation {
  Instant evaluationTime;
  EvalState evaluationState;
  Map<String, NumberValueCapture> values;
}

package org.hypertrace.alerting.engine;

import java.util.List;
import org.hypertrace.alerting.datamodel.AlertRule;
import org.hypertrace.alerting.datamodel.EvaluationResult;
import org.hypertrace.alerting.notification.service.AlertDispatchException;

/** Downstream of an evaluation: state tracking and notification. */
public interface ResultHandler {
  void handle(AlertRule rule, List<EvaluationResult> results) throws AlertDispatchException;
}

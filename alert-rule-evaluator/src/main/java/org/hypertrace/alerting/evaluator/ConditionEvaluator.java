package org.hypertrace.alerting.evaluator;

import java.time.Instant;
import java.util.List;
import org.hypertrace.alerting.datamodel.Condition;
import org.hypertrace.alerting.datamodel.EvaluationResult;

public interface ConditionEvaluator {

  /**
   * Executes the condition's queries and expressions at {@code evalTime}.
   *
   * @return one result per instance, or a single NoData result when nothing was returned
   * @throws QueryException when a data query fails
   * @throws EvaluationException on any other evaluation failure, including cancellation
   * @throws IllegalArgumentException when the condition itself is malformed
   */
  List<EvaluationResult> conditionEval(
      Condition condition, Instant evalTime, EvaluationContext context)
      throws EvaluationException;
}

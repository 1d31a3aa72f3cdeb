package org.hypertrace.alerting.evaluator;

import com.google.common.annotations.VisibleForTesting;
import com.typesafe.config.Config;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;
import org.hypertrace.alerting.datamodel.AlertQuery;
import org.hypertrace.alerting.datamodel.Condition;
import org.hypertrace.alerting.datamodel.EvalState;
import org.hypertrace.alerting.datamodel.EvaluationResult;
import org.hypertrace.alerting.datamodel.Labels;
import org.hypertrace.alerting.datamodel.NumberValueCapture;
import org.hypertrace.alerting.evaluator.datasource.QueryRequestHandler;
import org.hypertrace.alerting.evaluator.datasource.TimeSeries;
import org.hypertrace.alerting.evaluator.expression.ExpressionExecutor;
import org.hypertrace.alerting.evaluator.expression.NodeResult;
import org.hypertrace.alerting.evaluator.expression.NumberValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Evaluates a rule condition: runs its data queries, feeds them through the expression nodes and
 * turns the value of the condition node into one {@link EvaluationResult} per label set.
 */
public class AlertConditionEvaluator implements ConditionEvaluator {
  private static final Logger LOGGER = LoggerFactory.getLogger(AlertConditionEvaluator.class);

  private static final String EVALUATION_COUNTER = "hypertrace.alerting.evaluator.evaluations";
  private static final String EVALUATION_FAILURE_COUNTER =
      "hypertrace.alerting.evaluator.evaluation.failures";
  private static final ConcurrentMap<Long, Counter> evaluationCounter = new ConcurrentHashMap<>();
  private static final ConcurrentMap<Long, Counter> evaluationFailureCounter =
      new ConcurrentHashMap<>();

  private final QueryRequestHandler queryRequestHandler;
  private final ExpressionExecutor expressionExecutor;
  private final Clock clock;

  public AlertConditionEvaluator(Config appConfig, Clock clock) {
    this(new QueryRequestHandler(appConfig), clock);
  }

  @VisibleForTesting
  public AlertConditionEvaluator(QueryRequestHandler queryRequestHandler, Clock clock) {
    this.queryRequestHandler = queryRequestHandler;
    this.expressionExecutor = new ExpressionExecutor();
    this.clock = clock;
  }

  @Override
  public List<EvaluationResult> conditionEval(
      Condition condition, Instant evalTime, EvaluationContext context)
      throws EvaluationException {
    validate(condition);
    Instant start = clock.instant();
    getCounter(evaluationCounter, EVALUATION_COUNTER, condition.getOrgId()).increment();
    try {
      Map<String, NodeResult> nodeResults = executeNodes(condition, evalTime, context);
      context.checkNotCancelled();
      return toResults(
          condition, nodeResults, evalTime, Duration.between(start, clock.instant()));
    } catch (EvaluationException e) {
      getCounter(evaluationFailureCounter, EVALUATION_FAILURE_COUNTER, condition.getOrgId())
          .increment();
      throw e;
    } catch (RuntimeException e) {
      getCounter(evaluationFailureCounter, EVALUATION_FAILURE_COUNTER, condition.getOrgId())
          .increment();
      throw new EvaluationException(
          String.format("failed to evaluate condition %s", condition.getCondition()), e);
    }
  }

  /** Checks the shape of the condition graph. Violations throw {@link IllegalArgumentException}. */
  public static void validate(Condition condition) {
    List<AlertQuery> data = condition.getData();
    if (data == null || data.isEmpty()) {
      throw new IllegalArgumentException("condition has no queries or expressions");
    }
    Set<String> refIds = new HashSet<>();
    boolean hasDataQuery = false;
    for (AlertQuery query : data) {
      if (!refIds.add(query.getRefId())) {
        throw new IllegalArgumentException(
            String.format("duplicate refId:%s in condition", query.getRefId()));
      }
      hasDataQuery |= !query.isExpression();
    }
    if (!hasDataQuery) {
      throw new IllegalArgumentException("condition has no data source query");
    }
    if (!refIds.contains(condition.getCondition())) {
      throw new IllegalArgumentException(
          String.format("condition refId:%s not found in queries", condition.getCondition()));
    }
    for (AlertQuery query : data) {
      if (!query.isExpression()) {
        continue;
      }
      for (String input : ExpressionExecutor.getInputRefIds(query)) {
        if (!refIds.contains(input)) {
          throw new IllegalArgumentException(
              String.format(
                  "expression %s refers to unknown input:%s", query.getRefId(), input));
        }
      }
    }
  }

  private Map<String, NodeResult> executeNodes(
      Condition condition, Instant evalTime, EvaluationContext context)
      throws EvaluationException {
    Map<String, NodeResult> results = new LinkedHashMap<>();
    List<AlertQuery> expressions = new ArrayList<>();
    for (AlertQuery query : condition.getData()) {
      if (query.isExpression()) {
        expressions.add(query);
        continue;
      }
      context.checkNotCancelled();
      try {
        List<TimeSeries> series =
            queryRequestHandler.executeQuery(
                context,
                query,
                query.getRelativeTimeRange().start(evalTime),
                query.getRelativeTimeRange().end(evalTime));
        results.put(query.getRefId(), NodeResult.ofSeries(series));
      } catch (IOException | RuntimeException e) {
        LOGGER.debug("query {} of org {} failed", query.getRefId(), condition.getOrgId(), e);
        throw new QueryException(query.getRefId(), e);
      }
    }

    // expressions run once all their inputs are available
    while (!expressions.isEmpty()) {
      context.checkNotCancelled();
      boolean progressed = false;
      for (AlertQuery expression : new ArrayList<>(expressions)) {
        if (!results.keySet().containsAll(ExpressionExecutor.getInputRefIds(expression))) {
          continue;
        }
        results.put(expression.getRefId(), expressionExecutor.execute(expression, results));
        expressions.remove(expression);
        progressed = true;
      }
      if (!progressed) {
        throw new IllegalArgumentException(
            String.format(
                "cyclic expression dependencies among:%s",
                expressions.stream().map(AlertQuery::getRefId).collect(Collectors.toList())));
      }
    }
    return results;
  }

  private List<EvaluationResult> toResults(
      Condition condition,
      Map<String, NodeResult> nodeResults,
      Instant evalTime,
      Duration evaluationDuration) {
    List<NumberValue> conditionNumbers = nodeResults.get(condition.getCondition()).asNumbers();
    if (conditionNumbers.isEmpty()) {
      return List.of(
          EvaluationResult.builder()
              .state(EvalState.NoData)
              .evaluatedAt(evalTime)
              .evaluationDuration(evaluationDuration)
              .build());
    }

    List<EvaluationResult> results = new ArrayList<>();
    for (NumberValue number : conditionNumbers) {
      Map<String, NumberValueCapture> captures =
          captureValues(condition.getCondition(), number.getLabels(), nodeResults);
      results.add(
          EvaluationResult.builder()
              .instance(number.getLabels())
              .state(stateOf(number.getValue()))
              .evaluatedAt(evalTime)
              .evaluationDuration(evaluationDuration)
              .values(captures)
              .evaluationString(evaluationString(captures))
              .build());
    }
    return results;
  }

  private static EvalState stateOf(Double value) {
    if (value == null || value.isNaN()) {
      return EvalState.NoData;
    }
    return value != 0 ? EvalState.Alerting : EvalState.Normal;
  }

  private static Map<String, NumberValueCapture> captureValues(
      String conditionRefId, Labels labels, Map<String, NodeResult> nodeResults) {
    Map<String, NumberValueCapture> captures = new HashMap<>();
    nodeResults.forEach(
        (refId, result) -> {
          if (refId.equals(conditionRefId) || result.isSeries()) {
            return;
          }
          result.getNumbers().stream()
              .filter(n -> n.getLabels().equals(labels))
              .findFirst()
              .ifPresent(
                  n -> captures.put(refId, new NumberValueCapture(refId, n.getLabels(), n.getValue())));
        });
    return Map.copyOf(captures);
  }

  @VisibleForTesting
  static String evaluationString(Map<String, NumberValueCapture> captures) {
    return captures.keySet().stream()
        .sorted()
        .map(captures::get)
        .map(
            capture ->
                String.format(
                    "[ var='%s' labels=%s value=%s ]",
                    capture.getVar(), capture.getLabels().stringKey(), formatValue(capture.getValue())))
        .collect(Collectors.joining(", "));
  }

  private static String formatValue(Double value) {
    if (value == null) {
      return "null";
    }
    if (value == Math.rint(value) && !value.isInfinite()) {
      return String.valueOf(value.longValue());
    }
    return String.valueOf(value);
  }

  private static Counter getCounter(
      ConcurrentMap<Long, Counter> counters, String name, long orgId) {
    return counters.computeIfAbsent(
        orgId,
        k -> Counter.builder(name).tag("orgId", String.valueOf(k)).register(Metrics.globalRegistry));
  }
}

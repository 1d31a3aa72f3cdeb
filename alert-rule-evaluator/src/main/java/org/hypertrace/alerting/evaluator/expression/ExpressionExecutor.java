package org.hypertrace.alerting.evaluator.expression;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.DoublePredicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.hypertrace.alerting.datamodel.AlertQuery;
import org.hypertrace.alerting.evaluator.datasource.TimeSeries;

/**
 * Executes the server side expressions a condition may contain. Only the subset needed to turn
 * query output into a per-instance firing decision is supported: reduce, threshold and a single
 * comparison math expression.
 */
public class ExpressionExecutor {
  static final String TYPE = "type";
  static final String EXPRESSION = "expression";
  static final String REDUCER = "reducer";
  static final String CONDITIONS = "conditions";
  static final String EVALUATOR = "evaluator";
  static final String PARAMS = "params";

  private static final Pattern MATH_COMPARISON =
      Pattern.compile("^\\s*\\$\\{?(\\w+)}?\\s*(>=|<=|==|!=|>|<)\\s*(-?\\d+(?:\\.\\d+)?)\\s*$");

  public static List<String> getInputRefIds(AlertQuery node) {
    String type = node.getModel().path(TYPE).asText();
    if ("math".equals(type)) {
      Matcher matcher = MATH_COMPARISON.matcher(node.getModel().path(EXPRESSION).asText());
      return matcher.matches() ? List.of(matcher.group(1)) : List.of();
    }
    String input = node.getModel().path(EXPRESSION).asText();
    return input.isEmpty() ? List.of() : List.of(input);
  }

  public NodeResult execute(AlertQuery node, Map<String, NodeResult> inputs) {
    JsonNode model = node.getModel();
    String type = model.path(TYPE).asText();
    switch (type) {
      case "reduce":
        return reduce(node, getInput(node, inputs, model.path(EXPRESSION).asText()));
      case "threshold":
        return threshold(node, getInput(node, inputs, model.path(EXPRESSION).asText()));
      case "math":
        return math(node, inputs);
      default:
        throw new IllegalArgumentException(
            String.format("Unsupported expression type:%s for refId:%s", type, node.getRefId()));
    }
  }

  private NodeResult getInput(AlertQuery node, Map<String, NodeResult> inputs, String refId) {
    NodeResult input = inputs.get(refId);
    if (input == null) {
      throw new IllegalArgumentException(
          String.format("Expression %s refers to unknown input:%s", node.getRefId(), refId));
    }
    return input;
  }

  private NodeResult reduce(AlertQuery node, NodeResult input) {
    if (!input.isSeries()) {
      throw new IllegalArgumentException(
          String.format("Reduce expression %s expects a series input", node.getRefId()));
    }
    Reducer reducer = Reducer.fromName(node.getModel().path(REDUCER).asText("last"));
    List<NumberValue> numbers = new ArrayList<>();
    for (TimeSeries series : input.getSeries()) {
      numbers.add(new NumberValue(series.getLabels(), reducer.reduce(series.getPoints())));
    }
    return NodeResult.ofNumbers(numbers);
  }

  private NodeResult threshold(AlertQuery node, NodeResult input) {
    JsonNode evaluator = node.getModel().path(CONDITIONS).path(0).path(EVALUATOR);
    JsonNode params = evaluator.path(PARAMS);
    String evaluatorType = evaluator.path(TYPE).asText();
    DoublePredicate predicate;
    switch (evaluatorType) {
      case "gt":
        predicate = value -> value > params.path(0).asDouble();
        break;
      case "lt":
        predicate = value -> value < params.path(0).asDouble();
        break;
      case "within_range":
        predicate =
            value -> value > params.path(0).asDouble() && value < params.path(1).asDouble();
        break;
      case "outside_range":
        predicate =
            value -> value < params.path(0).asDouble() || value > params.path(1).asDouble();
        break;
      default:
        throw new IllegalArgumentException(
            String.format(
                "Unsupported threshold evaluator:%s for refId:%s", evaluatorType, node.getRefId()));
    }
    return compare(input, predicate);
  }

  private NodeResult math(AlertQuery node, Map<String, NodeResult> inputs) {
    String expression = node.getModel().path(EXPRESSION).asText();
    Matcher matcher = MATH_COMPARISON.matcher(expression);
    if (!matcher.matches()) {
      throw new IllegalArgumentException(
          String.format("Unsupported math expression:%s for refId:%s", expression, node.getRefId()));
    }
    NodeResult input = getInput(node, inputs, matcher.group(1));
    double rhs = Double.parseDouble(matcher.group(3));
    DoublePredicate predicate;
    switch (matcher.group(2)) {
      case ">":
        predicate = value -> value > rhs;
        break;
      case "<":
        predicate = value -> value < rhs;
        break;
      case ">=":
        predicate = value -> value >= rhs;
        break;
      case "<=":
        predicate = value -> value <= rhs;
        break;
      case "==":
        predicate = value -> value == rhs;
        break;
      default:
        predicate = value -> value != rhs;
    }
    return compare(input, predicate);
  }

  private static NodeResult compare(NodeResult input, DoublePredicate predicate) {
    List<NumberValue> numbers = new ArrayList<>();
    for (NumberValue number : input.asNumbers()) {
      Double value = number.getValue();
      Double result =
          value == null || value.isNaN() ? null : (predicate.test(value) ? 1.0 : 0.0);
      numbers.add(new NumberValue(number.getLabels(), result));
    }
    return NodeResult.ofNumbers(numbers);
  }
}

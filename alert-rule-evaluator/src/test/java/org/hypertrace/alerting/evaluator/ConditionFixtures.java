package org.hypertrace.alerting.evaluator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;
import org.hypertrace.alerting.datamodel.AlertQuery;
import org.hypertrace.alerting.datamodel.Condition;

public class ConditionFixtures {
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  public static AlertQuery dataQuery(String refId, String datasourceUid, String expr) {
    ObjectNode model = OBJECT_MAPPER.createObjectNode();
    model.put("expr", expr);
    return AlertQuery.builder().refId(refId).datasourceUid(datasourceUid).model(model).build();
  }

  public static AlertQuery reduce(String refId, String input, String reducer) {
    ObjectNode model = OBJECT_MAPPER.createObjectNode();
    model.put("type", "reduce");
    model.put("expression", input);
    model.put("reducer", reducer);
    return expression(refId, model);
  }

  public static AlertQuery threshold(String refId, String input, String type, double... params) {
    ObjectNode model = OBJECT_MAPPER.createObjectNode();
    model.put("type", "threshold");
    model.put("expression", input);
    ObjectNode evaluator = model.putArray("conditions").addObject().putObject("evaluator");
    evaluator.put("type", type);
    for (double param : params) {
      evaluator.withArray("params").add(param);
    }
    return expression(refId, model);
  }

  public static AlertQuery math(String refId, String expression) {
    ObjectNode model = OBJECT_MAPPER.createObjectNode();
    model.put("type", "math");
    model.put("expression", expression);
    return expression(refId, model);
  }

  public static Condition lastAbove(String datasourceUid, double threshold) {
    return new Condition(
        "C",
        1L,
        List.of(
            dataQuery("A", datasourceUid, "cpu_usage"),
            reduce("B", "A", "last"),
            threshold("C", "B", "gt", threshold)));
  }

  private static AlertQuery expression(String refId, ObjectNode model) {
    return AlertQuery.builder()
        .refId(refId)
        .datasourceUid(AlertQuery.EXPRESSION_DATASOURCE_UID)
        .model(model)
        .build();
  }
}

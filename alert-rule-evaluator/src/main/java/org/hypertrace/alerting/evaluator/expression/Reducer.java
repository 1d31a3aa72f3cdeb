package org.hypertrace.alerting.evaluator.expression;

import java.util.List;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.apache.commons.lang3.tuple.Pair;

/** Reduces a series to a single number. Every reducer except count yields null for no points. */
public enum Reducer {
  LAST(values -> values.isEmpty() ? null : values.get(values.size() - 1)),
  MEAN(values -> values.isEmpty() ? null : sum(values) / values.size()),
  MIN(values -> values.stream().min(Double::compare).orElse(null)),
  MAX(values -> values.stream().max(Double::compare).orElse(null)),
  SUM(values -> values.isEmpty() ? null : sum(values)),
  COUNT(values -> (double) values.size());

  private final Function<List<Double>, Double> function;

  Reducer(Function<List<Double>, Double> function) {
    this.function = function;
  }

  public Double reduce(List<Pair<Long, Double>> points) {
    return function.apply(points.stream().map(Pair::getValue).collect(Collectors.toList()));
  }

  private static double sum(List<Double> values) {
    return values.stream().mapToDouble(Double::doubleValue).sum();
  }

  public static Reducer fromName(String name) {
    for (Reducer reducer : values()) {
      if (reducer.name().equalsIgnoreCase(name)) {
        return reducer;
      }
    }
    throw new IllegalArgumentException(String.format("Unsupported reducer:%s", name));
  }
}

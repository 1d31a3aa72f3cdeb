package org.hypertrace.alerting.evaluator.expression;

import java.util.List;
import java.util.stream.Collectors;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import org.hypertrace.alerting.evaluator.datasource.TimeSeries;

/** Output of one node of the condition graph: series for queries, numbers for most expressions. */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class NodeResult {
  private final List<TimeSeries> series;
  private final List<NumberValue> numbers;

  public static NodeResult ofSeries(List<TimeSeries> series) {
    return new NodeResult(series, null);
  }

  public static NodeResult ofNumbers(List<NumberValue> numbers) {
    return new NodeResult(null, numbers);
  }

  public boolean isSeries() {
    return series != null;
  }

  /** Numbers of this node, reducing series to their last point when needed. */
  public List<NumberValue> asNumbers() {
    if (!isSeries()) {
      return numbers;
    }
    return series.stream()
        .map(s -> new NumberValue(s.getLabels(), Reducer.LAST.reduce(s.getPoints())))
        .collect(Collectors.toList());
  }
}

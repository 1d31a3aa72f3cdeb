package org.hypertrace.alerting.evaluator.datasource;

import java.io.IOException;
import java.time.Instant;
import java.util.List;
import org.hypertrace.alerting.datamodel.AlertQuery;
import org.hypertrace.alerting.evaluator.EvaluationContext;

public interface DataSourceQueryClient {

  /**
   * Runs {@code query} over [start, end]. Implementations must stop waiting once the context is
   * cancelled or its deadline passes.
   */
  List<TimeSeries> query(
      EvaluationContext context, DataSource dataSource, AlertQuery query, Instant start, Instant end)
      throws IOException;
}

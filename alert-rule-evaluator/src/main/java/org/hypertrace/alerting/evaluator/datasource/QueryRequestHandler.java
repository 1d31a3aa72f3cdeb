package org.hypertrace.alerting.evaluator.datasource;

import com.google.common.annotations.VisibleForTesting;
import com.typesafe.config.Config;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import okhttp3.OkHttpClient;
import org.hypertrace.alerting.datamodel.AlertQuery;
import org.hypertrace.alerting.evaluator.EvaluationContext;

/** Routes a data query to the client matching its data source type. */
public class QueryRequestHandler {
  public static final String PROMETHEUS_TYPE = "prometheus";

  private static final ConcurrentMap<String, Timer> queryTimer = new ConcurrentHashMap<>();
  private static final String QUERY_TIMER = "hypertrace.alerting.evaluator.query.latency";

  private final DataSourceRegistry dataSourceRegistry;
  private final Map<String, DataSourceQueryClient> clients;

  public QueryRequestHandler(Config appConfig) {
    this(
        DataSourceRegistry.from(appConfig),
        Map.of(PROMETHEUS_TYPE, new PrometheusQueryClient(new OkHttpClient())));
  }

  @VisibleForTesting
  public QueryRequestHandler(
      DataSourceRegistry dataSourceRegistry, Map<String, DataSourceQueryClient> clients) {
    this.dataSourceRegistry = dataSourceRegistry;
    this.clients = Map.copyOf(clients);
  }

  public List<TimeSeries> executeQuery(
      EvaluationContext context, AlertQuery query, Instant start, Instant end) throws IOException {
    DataSource dataSource =
        dataSourceRegistry
            .get(query.getDatasourceUid())
            .orElseThrow(
                () ->
                    new IOException(
                        String.format("data source not found:%s", query.getDatasourceUid())));
    DataSourceQueryClient client = clients.get(dataSource.getType());
    if (client == null) {
      throw new IOException(String.format("unsupported data source type:%s", dataSource.getType()));
    }

    Instant startTime = Instant.now();
    try {
      return client.query(context, dataSource, query, start, end);
    } finally {
      queryTimer
          .computeIfAbsent(
              dataSource.getType(),
              k -> Timer.builder(QUERY_TIMER).tag("type", k).register(Metrics.globalRegistry))
          .record(Duration.between(startTime, Instant.now()).toMillis(), TimeUnit.MILLISECONDS);
    }
  }
}

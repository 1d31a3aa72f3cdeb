package org.hypertrace.alerting.evaluator.datasource;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import okhttp3.Call;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.commons.lang3.tuple.Pair;
import org.hypertrace.alerting.datamodel.AlertQuery;
import org.hypertrace.alerting.datamodel.Labels;
import org.hypertrace.alerting.evaluator.EvaluationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Range-query client for Prometheus compatible APIs. Queries are always sent as GET since some
 * Prometheus compatible backends reject POST on query_range.
 */
public class PrometheusQueryClient implements DataSourceQueryClient {
  private static final Logger LOGGER = LoggerFactory.getLogger(PrometheusQueryClient.class);
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
  private static final String QUERY_RANGE_PATH = "api/v1/query_range";
  private static final String EXPR = "expr";
  private static final String STEP = "step";
  private static final Duration DEFAULT_STEP = Duration.ofSeconds(15);
  private static final String METRIC_NAME_LABEL = "__name__";
  // Prometheus duration syntax, e.g. 15s, 1m30s, 500ms
  private static final Pattern PROMETHEUS_DURATION =
      Pattern.compile(
          "^(?:(\\d+)y)?(?:(\\d+)w)?(?:(\\d+)d)?(?:(\\d+)h)?(?:(\\d+)m)?(?:(\\d+)s)?(?:(\\d+)ms)?$");
  private static final Pattern SECONDS = Pattern.compile("^\\d+(?:\\.\\d+)?$");
  private static final long[] PROMETHEUS_DURATION_UNIT_MILLIS = {
    TimeUnit.DAYS.toMillis(365),
    TimeUnit.DAYS.toMillis(7),
    TimeUnit.DAYS.toMillis(1),
    TimeUnit.HOURS.toMillis(1),
    TimeUnit.MINUTES.toMillis(1),
    TimeUnit.SECONDS.toMillis(1),
    1
  };

  private final OkHttpClient client;

  public PrometheusQueryClient(OkHttpClient client) {
    this.client = client;
  }

  @Override
  public List<TimeSeries> query(
      EvaluationContext context, DataSource dataSource, AlertQuery query, Instant start, Instant end)
      throws IOException {
    JsonNode expr = query.getModel().get(EXPR);
    if (expr == null || expr.asText().isEmpty()) {
      throw new IOException("query expression is empty");
    }

    HttpUrl baseUrl = HttpUrl.parse(dataSource.getUrl());
    if (baseUrl == null) {
      throw new IOException(String.format("invalid data source url:%s", dataSource.getUrl()));
    }
    HttpUrl url =
        baseUrl
            .newBuilder()
            .addPathSegments(QUERY_RANGE_PATH)
            .addQueryParameter("query", expr.asText())
            .addQueryParameter("start", String.valueOf(start.getEpochSecond()))
            .addQueryParameter("end", String.valueOf(end.getEpochSecond()))
            .addQueryParameter("step", formatStep(getStep(query)))
            .build();

    Request.Builder requestBuilder = new Request.Builder().url(url).get();
    dataSource.getHeaders().forEach(requestBuilder::header);
    context.getRequestHeaders().forEach(requestBuilder::header);
    Request request = requestBuilder.build();

    if (context.isCancelled()) {
      throw new IOException("evaluation deadline exceeded before query was sent");
    }
    LOGGER.debug("Executing request method:{} url:{}", request.method(), url);
    Call call = client.newBuilder().callTimeout(context.remaining()).build().newCall(request);
    context.onCancel(call::cancel);

    try (Response response = call.execute()) {
      ResponseBody body = response.body();
      String bodyString = body == null ? "" : body.string();
      if (!response.isSuccessful()) {
        LOGGER.error(
            "got bad response status from datasource status:{} method:{} url:{}",
            response.code(),
            request.method(),
            url);
        throw new IOException(
            String.format("bad response status %d: %s", response.code(), bodyString));
      }
      return parseMatrix(OBJECT_MAPPER.readTree(bodyString));
    }
  }

  private static Duration getStep(AlertQuery query) throws IOException {
    JsonNode step = query.getModel().get(STEP);
    if (step == null || step.asText().isEmpty()) {
      return DEFAULT_STEP;
    }
    Duration duration = parseDuration(step.asText());
    if (duration.isZero() || duration.isNegative()) {
      throw new IOException(String.format("invalid query step:%s", step.asText()));
    }
    return duration;
  }

  /**
   * Parses a step as Prometheus accepts it: a duration such as {@code 15s} or {@code 1m30s}, or a
   * plain number of seconds. ISO-8601 durations such as {@code PT15S} are accepted too.
   */
  static Duration parseDuration(String value) throws IOException {
    Matcher matcher = PROMETHEUS_DURATION.matcher(value);
    if (matcher.matches()) {
      long millis = 0;
      boolean anyUnit = false;
      for (int i = 0; i < PROMETHEUS_DURATION_UNIT_MILLIS.length; i++) {
        String group = matcher.group(i + 1);
        if (group != null) {
          millis += Long.parseLong(group) * PROMETHEUS_DURATION_UNIT_MILLIS[i];
          anyUnit = true;
        }
      }
      if (anyUnit) {
        return Duration.ofMillis(millis);
      }
    }
    if (SECONDS.matcher(value).matches()) {
      return Duration.ofMillis(Math.round(Double.parseDouble(value) * 1000));
    }
    try {
      return Duration.parse(value);
    } catch (DateTimeParseException e) {
      throw new IOException(String.format("invalid query step:%s", value), e);
    }
  }

  private static String formatStep(Duration step) {
    long millis = step.toMillis();
    return millis % 1000 == 0 ? millis / 1000 + "s" : millis + "ms";
  }

  private static double parseSampleValue(String value) {
    switch (value) {
      case "+Inf":
        return Double.POSITIVE_INFINITY;
      case "-Inf":
        return Double.NEGATIVE_INFINITY;
      default:
        return Double.parseDouble(value);
    }
  }

  static List<TimeSeries> parseMatrix(JsonNode root) throws IOException {
    if (!"success".equals(root.path("status").asText())) {
      throw new IOException(
          String.format(
              "query failed: %s %s",
              root.path("errorType").asText(), root.path("error").asText()));
    }
    JsonNode data = root.path("data");
    if (!"matrix".equals(data.path("resultType").asText())) {
      throw new IOException(
          String.format("unexpected result type:%s", data.path("resultType").asText()));
    }

    List<TimeSeries> series = new ArrayList<>();
    for (JsonNode result : data.path("result")) {
      Map<String, String> labels = new HashMap<>();
      result
          .path("metric")
          .fields()
          .forEachRemaining(
              entry -> {
                if (!METRIC_NAME_LABEL.equals(entry.getKey())) {
                  labels.put(entry.getKey(), entry.getValue().asText());
                }
              });
      List<Pair<Long, Double>> points = new ArrayList<>();
      for (JsonNode value : result.path("values")) {
        long timestampMillis = (long) (value.get(0).asDouble() * 1000);
        points.add(Pair.of(timestampMillis, parseSampleValue(value.get(1).asText())));
      }
      series.add(new TimeSeries(Labels.of(labels), points));
    }
    return series;
  }
}

package org.hypertrace.alerting.engine.api;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import org.hypertrace.alerting.datamodel.EvalState;
import org.hypertrace.alerting.datamodel.EvaluationResult;
import org.hypertrace.alerting.datamodel.Labels;
import org.hypertrace.alerting.datamodel.NumberValueCapture;
import org.hypertrace.alerting.evaluator.EvaluationException;
import org.hypertrace.alerting.evaluator.QueryException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class ApiConvertersTest {
  private static final Instant T0 = Instant.parse("2022-10-01T10:00:00Z");

  @Test
  void testResultSurvivesApiForm() {
    Labels instance = Labels.of(Map.of("host", "a"));
    EvaluationResult result =
        EvaluationResult.builder()
            .instance(instance)
            .state(EvalState.Alerting)
            .evaluatedAt(T0)
            .evaluationDuration(Duration.ofMillis(120))
            .evaluationString("[ var='B' labels={host=a} value=95 ]")
            .values(Map.of("B", new NumberValueCapture("B", instance, 95.0)))
            .build();

    EvaluationResult converted = ApiConverters.fromApi(ApiConverters.toApi(result));

    Assertions.assertEquals(result, converted);
  }

  @Test
  void testQueryErrorKeepsRefId() {
    EvaluationResult result =
        EvaluationResult.error(
            new QueryException("A", new IOException("connection refused")), T0, Duration.ZERO);

    ApiEvalResult apiResult = ApiConverters.toApi(result);
    Assertions.assertEquals(ApiErrorType.QUERY_ERROR, apiResult.getError().getType());
    Assertions.assertEquals(Integer.valueOf(EvalState.Error.ordinal()), apiResult.getState());

    Throwable error = ApiConverters.fromApi(apiResult).getError();
    Assertions.assertTrue(error instanceof QueryException);
    Assertions.assertEquals("A", ((QueryException) error).getRefId());
    Assertions.assertEquals("connection refused", ((QueryException) error).getQueryErrorMessage());
  }

  @Test
  void testOtherErrorsBecomeEvaluationExceptions() {
    ApiEvalResult apiResult =
        ApiConverters.toApi(
            EvaluationResult.error(
                new EvaluationException("evaluation deadline exceeded"), T0, Duration.ZERO));
    Assertions.assertEquals(ApiErrorType.OTHER, apiResult.getError().getType());
    Assertions.assertTrue(apiResult.getError().getMetadata().isEmpty());

    Throwable error = ApiConverters.fromApi(apiResult).getError();
    Assertions.assertEquals(EvaluationException.class, error.getClass());
    Assertions.assertEquals("evaluation deadline exceeded", error.getMessage());
  }

  @Test
  void testUnknownStateIsRejected() {
    Assertions.assertThrows(
        IllegalArgumentException.class,
        () -> ApiConverters.fromApi(ApiEvalResult.builder().state(-1).evaluatedAt(T0).build()));
  }
}

package org.hypertrace.alerting.engine.api;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.hypertrace.alerting.datamodel.EvalState;
import org.hypertrace.alerting.datamodel.EvaluationResult;
import org.hypertrace.alerting.datamodel.Labels;
import org.hypertrace.alerting.datamodel.NumberValueCapture;
import org.hypertrace.alerting.evaluator.EvaluationException;
import org.hypertrace.alerting.evaluator.QueryException;

public class ApiConverters {

  public static List<ApiEvalResult> toApi(List<EvaluationResult> results) {
    return results.stream().map(ApiConverters::toApi).collect(Collectors.toList());
  }

  public static List<EvaluationResult> fromApi(List<ApiEvalResult> results) {
    if (results == null) {
      return List.of();
    }
    return results.stream().map(ApiConverters::fromApi).collect(Collectors.toList());
  }

  public static ApiEvalResult toApi(EvaluationResult result) {
    Map<String, ApiNumberValueCapture> values = new HashMap<>();
    result
        .getValues()
        .forEach(
            (key, capture) ->
                values.put(
                    key,
                    ApiNumberValueCapture.builder()
                        .var(capture.getVar())
                        .labels(capture.getLabels().asMap())
                        .value(capture.getValue())
                        .build()));
    return ApiEvalResult.builder()
        .instance(result.getInstance().asMap())
        .state(result.getState().ordinal())
        .stateName(result.getState().name())
        .evaluatedAt(result.getEvaluatedAt())
        .evaluationDuration(result.getEvaluationDuration())
        .evaluationString(result.getEvaluationString())
        .values(values)
        .error(result.getErrorOptional().map(ApiConverters::toApiError).orElse(null))
        .build();
  }

  /**
   * Converts a client supplied result. Absent maps are read as empty; a result without a state or
   * an evaluation time is rejected with an {@link IllegalArgumentException}.
   */
  public static EvaluationResult fromApi(ApiEvalResult result) {
    if (result == null) {
      throw new IllegalArgumentException("Missing evaluation result");
    }
    if (result.getEvaluatedAt() == null) {
      throw new IllegalArgumentException("Missing evaluatedAt of evaluation result");
    }
    Map<String, NumberValueCapture> values = new HashMap<>();
    if (result.getValues() != null) {
      result
          .getValues()
          .forEach(
              (key, capture) -> {
                if (capture != null) {
                  values.put(
                      key,
                      new NumberValueCapture(
                          capture.getVar(), Labels.of(capture.getLabels()), capture.getValue()));
                }
              });
    }
    EvaluationResult.EvaluationResultBuilder builder =
        EvaluationResult.builder()
            .instance(Labels.of(result.getInstance()))
            .state(toEvalState(result.getState()))
            .evaluatedAt(result.getEvaluatedAt())
            .values(Map.copyOf(values))
            .error(result.getError() == null ? null : fromApiError(result.getError()));
    if (result.getEvaluationDuration() != null) {
      builder.evaluationDuration(result.getEvaluationDuration());
    }
    if (result.getEvaluationString() != null) {
      builder.evaluationString(result.getEvaluationString());
    }
    return builder.build();
  }

  static ApiEvalError toApiError(Throwable error) {
    if (error instanceof QueryException) {
      QueryException queryException = (QueryException) error;
      return ApiEvalError.builder()
          .type(ApiErrorType.QUERY_ERROR)
          .message(queryException.getQueryErrorMessage())
          .metadata(Map.of(ApiEvalError.REF_ID_METADATA, queryException.getRefId()))
          .build();
    }
    return ApiEvalError.builder()
        .type(ApiErrorType.OTHER)
        .message(String.valueOf(error.getMessage()))
        .build();
  }

  static Throwable fromApiError(ApiEvalError error) {
    String refId =
        error.getMetadata() == null ? null : error.getMetadata().get(ApiEvalError.REF_ID_METADATA);
    if (error.getType() == ApiErrorType.QUERY_ERROR && refId != null) {
      return new QueryException(refId, new IOException(error.getMessage()));
    }
    return new EvaluationException(error.getMessage());
  }

  private static EvalState toEvalState(Integer state) {
    if (state == null) {
      throw new IllegalArgumentException("Missing state of evaluation result");
    }
    EvalState[] states = EvalState.values();
    if (state < 0 || state >= states.length) {
      throw new IllegalArgumentException(String.format("Invalid evaluation state:%d", state));
    }
    return states[state];
  }
}

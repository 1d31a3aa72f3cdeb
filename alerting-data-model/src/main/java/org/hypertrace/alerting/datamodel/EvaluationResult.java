package org.hypertrace.alerting.datamodel;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import lombok.Builder;
import lombok.Value;

/** Outcome of one rule evaluation for one label set. Created per cycle, never mutated. */
@Value
@Builder(toBuilder = true)
public class EvaluationResult {
  @Builder.Default Labels instance = Labels.empty();
  EvalState state;
  Instant evaluatedAt;
  @Builder.Default Duration evaluationDuration = Duration.ZERO;
  @Builder.Default Map<String, NumberValueCapture> values = Map.of();
  Throwable error;
  @Builder.Default String evaluationString = "";

  public Optional<Throwable> getErrorOptional() {
    return Optional.ofNullable(error);
  }

  public static EvaluationResult error(Throwable error, Instant evaluatedAt, Duration duration) {
    return EvaluationResult.builder()
        .state(EvalState.Error)
        .error(error)
        .evaluatedAt(evaluatedAt)
        .evaluationDuration(duration)
        .build();
  }
}

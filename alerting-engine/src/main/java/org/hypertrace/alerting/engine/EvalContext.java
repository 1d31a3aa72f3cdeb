package org.hypertrace.alerting.engine;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.Builder;
import lombok.Value;
import org.hypertrace.alerting.datamodel.AlertRule;
import org.hypertrace.alerting.datamodel.EvalState;
import org.hypertrace.alerting.datamodel.EvaluationResult;

/** What happened during one evaluation cycle of a rule. */
@Value
@Builder
public class EvalContext {
  AlertRule rule;
  Instant evalTime;
  @Builder.Default List<EvaluationResult> results = List.of();
  @Builder.Default Duration duration = Duration.ZERO;
  Throwable error;

  public Optional<Throwable> getErrorOptional() {
    return Optional.ofNullable(error);
  }

  public boolean isFiring() {
    return results.stream().anyMatch(r -> r.getState() == EvalState.Alerting);
  }

  public boolean isNoDataFound() {
    return results.stream().anyMatch(r -> r.getState() == EvalState.NoData);
  }
}

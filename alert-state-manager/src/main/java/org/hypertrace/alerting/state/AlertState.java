package org.hypertrace.alerting.state;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import org.hypertrace.alerting.datamodel.EvalState;
import org.hypertrace.alerting.datamodel.Labels;
import org.hypertrace.alerting.datamodel.NumberValueCapture;

/**
 * State of a single alert instance, identified by its rule and full label set. Instances are
 * owned by the {@link StateManager}; only the send bookkeeping is updated from outside.
 */
@Getter
@Setter(AccessLevel.PACKAGE)
public class AlertState {
  private final long orgId;
  private final String alertRuleUid;
  private final String cacheId;
  private final Labels labels;
  private Map<String, String> annotations = Map.of();
  private EvalState state = EvalState.Normal;
  private boolean resolved;
  private boolean suppressed;
  private Instant startsAt;
  private Instant endsAt;
  private Instant lastEvaluationTime;
  private Duration evaluationDuration = Duration.ZERO;
  private String lastEvaluationString = "";
  private Map<String, NumberValueCapture> values = Map.of();
  private Throwable error;

  @Setter(AccessLevel.NONE)
  private Instant lastSentAt;

  @Getter(AccessLevel.NONE)
  @Setter(AccessLevel.NONE)
  private final List<Evaluation> results = new ArrayList<>();

  public AlertState(long orgId, String alertRuleUid, Labels labels) {
    this.orgId = orgId;
    this.alertRuleUid = alertRuleUid;
    this.labels = labels;
    this.cacheId = labels.stringKey();
  }

  public synchronized List<Evaluation> getResults() {
    return List.copyOf(results);
  }

  public Optional<Throwable> getErrorOptional() {
    return Optional.ofNullable(error);
  }

  public synchronized void markSent(Instant sentAt) {
    this.lastSentAt = sentAt;
  }

  /**
   * Whether this instance should be handed to the alertmanager now. Pending and suppressed
   * instances never are, Normal ones only while their resolution is undelivered; the rest are
   * resent once {@code resendDelay} passed since the last send.
   */
  public synchronized boolean needsSending(Duration resendDelay) {
    if (state == EvalState.Pending || suppressed) {
      return false;
    }
    if (state == EvalState.Normal) {
      return resolved && !isResolutionSent();
    }
    if (lastSentAt == null) {
      return true;
    }
    return !lastSentAt.plus(resendDelay).isAfter(lastEvaluationTime);
  }

  /** Whether a send was recorded at or after the instance entered its current Normal state. */
  synchronized boolean isResolutionSent() {
    return lastSentAt != null && startsAt != null && !lastSentAt.isBefore(startsAt);
  }

  synchronized void addResult(Evaluation evaluation, int maxResults) {
    results.add(evaluation);
    while (results.size() > maxResults) {
      results.remove(0);
    }
  }

  @Override
  public String toString() {
    return String.format(
        "AlertState{rule=%d/%s, labels=%s, state=%s, resolved=%s, startsAt=%s, endsAt=%s}",
        orgId, alertRuleUid, labels, state, resolved, startsAt, endsAt);
  }
}

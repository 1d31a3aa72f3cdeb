package org.hypertrace.alerting.state;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Strings.nullToEmpty;

import com.google.common.annotations.VisibleForTesting;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.hypertrace.alerting.datamodel.AlertInstance;
import org.hypertrace.alerting.datamodel.AlertRule;
import org.hypertrace.alerting.datamodel.AlertRuleKey;
import org.hypertrace.alerting.datamodel.EvalState;
import org.hypertrace.alerting.datamodel.EvaluationResult;
import org.hypertrace.alerting.datamodel.Labels;
import org.hypertrace.alerting.datamodel.SaveAlertInstanceCommand;
import org.hypertrace.alerting.state.store.InstanceStore;
import org.hypertrace.alerting.state.store.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Folds evaluation results into per-instance alert states. States live in memory, one map per
 * rule, and are loaded from the {@link InstanceStore} the first time a rule is seen.
 */
public class StateManager {
  private static final Logger LOGGER = LoggerFactory.getLogger(StateManager.class);

  public static final Duration RESEND_DELAY = Duration.ofSeconds(30);
  public static final int DEFAULT_MAX_EVALUATIONS = 10;

  private static final String STATE_TRANSITION_COUNTER = "hypertrace.alerting.state.transitions";
  private static final ConcurrentMap<String, Counter> stateTransitionCounter =
      new ConcurrentHashMap<>();

  private final ConcurrentMap<AlertRuleKey, ConcurrentMap<String, AlertState>> cache =
      new ConcurrentHashMap<>();
  // rules whose stored instances could not be loaded yet
  private final Set<AlertRuleKey> unloadedRules = ConcurrentHashMap.newKeySet();
  private final InstanceStore instanceStore;
  private final Clock clock;
  private final int maxEvaluations;

  public StateManager(InstanceStore instanceStore, Clock clock) {
    this(instanceStore, clock, DEFAULT_MAX_EVALUATIONS);
  }

  public StateManager(InstanceStore instanceStore, Clock clock, int maxEvaluations) {
    this.instanceStore = instanceStore;
    this.clock = clock;
    this.maxEvaluations = maxEvaluations;
  }

  /**
   * Applies a batch of results of one rule evaluation and returns the updated states, one per
   * result, in result order. Instances of the rule missing from the batch that went stale are
   * resolved, persisted and dropped from the cache.
   *
   * @throws IllegalArgumentException if a result has no state or evaluation time; no state is
   *     changed in that case
   */
  public List<AlertState> processEvalResults(AlertRule rule, List<EvaluationResult> results) {
    for (EvaluationResult result : results) {
      checkArgument(result.getState() != null, "Missing state of evaluation result");
      checkArgument(result.getEvaluatedAt() != null, "Missing evaluation time of result");
    }
    ConcurrentMap<String, AlertState> ruleStates = getRuleStates(rule);
    List<AlertState> states = new ArrayList<>(results.size());
    synchronized (ruleStates) {
      Set<String> processed = new HashSet<>();
      for (EvaluationResult result : results) {
        AlertState state = processEvalResult(rule, ruleStates, result);
        processed.add(state.getCacheId());
        states.add(state);
      }
      Instant evaluatedAt =
          results.isEmpty() ? clock.instant() : results.get(0).getEvaluatedAt();
      resolveStaleStates(rule, ruleStates, processed, evaluatedAt);
    }
    return states;
  }

  /** Persists the given states. A failing instance is logged and the rest are still saved. */
  public void saveAlertStates(List<AlertState> states) {
    for (AlertState state : states) {
      saveAlertState(state, state.getEndsAt());
    }
  }

  public List<AlertState> getStatesForRule(long orgId, String ruleUid) {
    ConcurrentMap<String, AlertState> ruleStates = cache.get(new AlertRuleKey(orgId, ruleUid));
    return ruleStates == null ? List.of() : List.copyOf(ruleStates.values());
  }

  public List<AlertState> getAll() {
    List<AlertState> states = new ArrayList<>();
    cache.values().forEach(ruleStates -> states.addAll(ruleStates.values()));
    return states;
  }

  @VisibleForTesting
  public void put(AlertState state) {
    cache
        .computeIfAbsent(
            new AlertRuleKey(state.getOrgId(), state.getAlertRuleUid()),
            k -> new ConcurrentHashMap<>())
        .put(state.getCacheId(), state);
  }

  /** Drops the cached states of a rule that is no longer evaluated. */
  public void removeStatesForRule(AlertRuleKey key) {
    cache.remove(key);
    unloadedRules.remove(key);
  }

  /**
   * Returns the cached states of a rule. Stored instances are loaded on first use; a failed load is
   * retried on every later call until it succeeds.
   */
  private ConcurrentMap<String, AlertState> getRuleStates(AlertRule rule) {
    AlertRuleKey key = rule.getKey();
    ConcurrentMap<String, AlertState> ruleStates =
        cache.computeIfAbsent(
            key,
            k -> {
              unloadedRules.add(k);
              return new ConcurrentHashMap<>();
            });
    if (unloadedRules.contains(key)) {
      synchronized (ruleStates) {
        if (unloadedRules.contains(key) && loadRuleStates(key, ruleStates)) {
          unloadedRules.remove(key);
        }
      }
    }
    return ruleStates;
  }

  // Instances already tracked in memory are newer than the stored ones and are kept.
  private boolean loadRuleStates(AlertRuleKey key, Map<String, AlertState> ruleStates) {
    List<AlertInstance> instances;
    try {
      instances = instanceStore.listAlertInstances(key.getOrgId(), key.getUid());
    } catch (PersistenceException e) {
      LOGGER.error(
          "Failed to load alert instances of rule {}, retrying on next evaluation", key, e);
      return false;
    }
    for (AlertInstance instance : instances) {
      AlertState state = new AlertState(key.getOrgId(), key.getUid(), instance.getLabels());
      state.setState(instance.getCurrentState());
      state.setStartsAt(instance.getCurrentStateSince());
      state.setEndsAt(instance.getCurrentStateEnd());
      state.setLastEvaluationTime(instance.getLastEvalTime());
      ruleStates.putIfAbsent(state.getCacheId(), state);
    }
    LOGGER.debug("Loaded {} alert instances of rule {}", instances.size(), key);
    return true;
  }

  private AlertState processEvalResult(
      AlertRule rule, Map<String, AlertState> ruleStates, EvaluationResult result) {
    Labels labels = instanceLabels(rule, result.getInstance());
    AlertState state =
        ruleStates.computeIfAbsent(
            labels.stringKey(), k -> new AlertState(rule.getOrgId(), rule.getUid(), labels));
    EvalState previous = state.getState();

    state.setLastEvaluationTime(result.getEvaluatedAt());
    state.setEvaluationDuration(result.getEvaluationDuration());
    state.setLastEvaluationString(result.getEvaluationString());
    state.setValues(result.getValues());
    state.setSuppressed(false);
    state.setError(null);
    state.addResult(
        new Evaluation(result.getEvaluatedAt(), result.getState(), result.getValues()),
        maxEvaluations);

    switch (result.getState()) {
      case Normal:
        resultNormal(state, result);
        break;
      case Alerting:
        resultAlerting(rule, state, result);
        break;
      case Error:
        resultError(rule, state, result);
        break;
      case NoData:
        resultNoData(rule, state, result);
        break;
      default:
        throw new IllegalArgumentException(
            String.format("Unexpected evaluation state:%s", result.getState()));
    }

    // a resolution stays pending until it has been delivered
    state.setResolved(
        state.getState() == EvalState.Normal
            && (previous == EvalState.Alerting
                || (previous == EvalState.Normal
                    && state.isResolved()
                    && !state.isResolutionSent())));
    state.setAnnotations(rule.getAnnotations());
    if (previous != state.getState()) {
      LOGGER.debug(
          "Alert instance {} of rule {} changed state {} -> {}",
          labels,
          rule.getKey(),
          previous,
          state.getState());
      stateTransitionCounter
          .computeIfAbsent(
              rule.getOrgId() + ":" + state.getState(),
              k ->
                  Counter.builder(STATE_TRANSITION_COUNTER)
                      .tag("orgId", String.valueOf(rule.getOrgId()))
                      .tag("state", state.getState().name())
                      .register(Metrics.globalRegistry))
          .increment();
    }
    return state;
  }

  private static void resultNormal(AlertState state, EvaluationResult result) {
    if (state.getState() != EvalState.Normal) {
      state.setStartsAt(result.getEvaluatedAt());
      state.setEndsAt(result.getEvaluatedAt());
    }
    state.setState(EvalState.Normal);
  }

  private static void resultAlerting(AlertRule rule, AlertState state, EvaluationResult result) {
    Instant evaluatedAt = result.getEvaluatedAt();
    switch (state.getState()) {
      case Alerting:
        setEndsAt(rule, state, evaluatedAt);
        break;
      case Pending:
        if (Duration.between(state.getStartsAt(), evaluatedAt).compareTo(rule.getForDuration())
            >= 0) {
          state.setState(EvalState.Alerting);
          state.setStartsAt(evaluatedAt);
        }
        setEndsAt(rule, state, evaluatedAt);
        break;
      default:
        state.setStartsAt(evaluatedAt);
        setEndsAt(rule, state, evaluatedAt);
        state.setState(
            rule.getForDuration().isZero() ? EvalState.Alerting : EvalState.Pending);
    }
  }

  private static void resultError(AlertRule rule, AlertState state, EvaluationResult result) {
    state.setError(result.getError());
    switch (rule.getExecErrState()) {
      case ALERTING:
        enterState(rule, state, result, EvalState.Alerting);
        break;
      case ERROR:
        enterState(rule, state, result, EvalState.Error);
        break;
      case OK:
        resultNormal(state, result);
        break;
      case KEEP_LAST_STATE:
        state.setSuppressed(true);
        break;
      default:
        throw new IllegalArgumentException(
            String.format("Unexpected error state policy:%s", rule.getExecErrState()));
    }
  }

  private static void resultNoData(AlertRule rule, AlertState state, EvaluationResult result) {
    switch (rule.getNoDataState()) {
      case ALERTING:
        enterState(rule, state, result, EvalState.Alerting);
        break;
      case NO_DATA:
        enterState(rule, state, result, EvalState.NoData);
        break;
      case OK:
        resultNormal(state, result);
        break;
      case KEEP_LAST_STATE:
        state.setSuppressed(true);
        break;
      default:
        throw new IllegalArgumentException(
            String.format("Unexpected no data policy:%s", rule.getNoDataState()));
    }
  }

  private static void enterState(
      AlertRule rule, AlertState state, EvaluationResult result, EvalState target) {
    if (state.getStartsAt() == null || state.getState() != target) {
      state.setStartsAt(result.getEvaluatedAt());
    }
    setEndsAt(rule, state, result.getEvaluatedAt());
    state.setState(target);
  }

  private static void setEndsAt(AlertRule rule, AlertState state, Instant evaluatedAt) {
    Duration interval = Duration.ofSeconds(rule.getIntervalSeconds());
    Duration ends = interval.compareTo(RESEND_DELAY) > 0 ? interval : RESEND_DELAY;
    state.setEndsAt(evaluatedAt.plus(ends.multipliedBy(3)));
  }

  private void resolveStaleStates(
      AlertRule rule,
      Map<String, AlertState> ruleStates,
      Set<String> processed,
      Instant evaluatedAt) {
    Duration staleAfter = Duration.ofSeconds(rule.getIntervalSeconds()).multipliedBy(2);
    List<AlertState> stale = new ArrayList<>();
    for (AlertState state : ruleStates.values()) {
      if (processed.contains(state.getCacheId()) || state.getLastEvaluationTime() == null) {
        continue;
      }
      if (!state.getLastEvaluationTime().plus(staleAfter).isAfter(evaluatedAt)) {
        stale.add(state);
      }
    }
    for (AlertState state : stale) {
      LOGGER.debug("Resolving stale alert instance {} of rule {}", state.getLabels(), rule.getKey());
      state.setResolved(state.getState() == EvalState.Alerting);
      state.setState(EvalState.Normal);
      state.setEndsAt(evaluatedAt);
      saveAlertState(state, evaluatedAt);
      ruleStates.remove(state.getCacheId());
    }
  }

  private void saveAlertState(AlertState state, Instant currentStateEnd) {
    SaveAlertInstanceCommand command =
        SaveAlertInstanceCommand.builder()
            .ruleOrgId(state.getOrgId())
            .ruleUid(state.getAlertRuleUid())
            .labels(state.getLabels())
            .state(state.getState())
            .lastEvalTime(state.getLastEvaluationTime())
            .currentStateSince(state.getStartsAt())
            .currentStateEnd(currentStateEnd)
            .build();
    try {
      instanceStore.saveAlertInstance(command);
    } catch (PersistenceException e) {
      LOGGER.error(
          "Failed to save alert instance {} of rule {}/{}",
          state.getLabels(),
          state.getOrgId(),
          state.getAlertRuleUid(),
          e);
    }
  }

  private static Labels instanceLabels(AlertRule rule, Labels resultLabels) {
    return Labels.of(rule.getLabels())
        .merge(resultLabels)
        .merge(
            Map.of(
                Labels.ALERT_NAME_LABEL, nullToEmpty(rule.getTitle()),
                Labels.RULE_UID_LABEL, nullToEmpty(rule.getUid()),
                Labels.NAMESPACE_UID_LABEL, nullToEmpty(rule.getNamespaceUid())));
  }
}

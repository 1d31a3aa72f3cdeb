package org.hypertrace.alerting.engine;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.hypertrace.alerting.datamodel.AlertRule;
import org.hypertrace.alerting.datamodel.EvaluationResult;
import org.hypertrace.alerting.evaluator.ConditionEvaluator;
import org.hypertrace.alerting.evaluator.EvaluationContext;
import org.hypertrace.alerting.evaluator.EvaluationException;
import org.hypertrace.alerting.notification.service.AlertDispatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs evaluation cycles. A cycle evaluates the rule under the evaluation timeout, then hands the
 * results to the {@link ResultHandler} under a separate notification timeout, so neither phase
 * can use up the other's budget.
 */
public class AlertEvaluatorEngine implements AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(AlertEvaluatorEngine.class);

  private static final String EVALUATION_TIMER = "hypertrace.alerting.engine.evaluation.duration";
  private static final String EVALUATION_FAILURE_COUNTER =
      "hypertrace.alerting.engine.evaluation.failures";
  private static final String DISPATCH_FAILURE_COUNTER =
      "hypertrace.alerting.engine.dispatch.failures";
  private static final ConcurrentMap<Long, Timer> evaluationTimer = new ConcurrentHashMap<>();
  private static final ConcurrentMap<Long, Counter> evaluationFailureCounter =
      new ConcurrentHashMap<>();
  private static final ConcurrentMap<Long, Counter> dispatchFailureCounter =
      new ConcurrentHashMap<>();

  private final ConditionEvaluator conditionEvaluator;
  private final ResultHandler resultHandler;
  private final EngineConfig engineConfig;
  private final Clock clock;
  private final ExecutorService evaluationExecutor;
  private final ExecutorService notificationExecutor;

  public AlertEvaluatorEngine(
      ConditionEvaluator conditionEvaluator,
      ResultHandler resultHandler,
      EngineConfig engineConfig,
      Clock clock) {
    this.conditionEvaluator = conditionEvaluator;
    this.resultHandler = resultHandler;
    this.engineConfig = engineConfig;
    this.clock = clock;
    this.evaluationExecutor =
        Executors.newFixedThreadPool(
            engineConfig.getEvaluationThreads(),
            new ThreadFactoryBuilder().setNameFormat("alert-evaluation-%d").setDaemon(true).build());
    this.notificationExecutor =
        Executors.newFixedThreadPool(
            engineConfig.getNotificationThreads(),
            new ThreadFactoryBuilder()
                .setNameFormat("alert-notification-%d")
                .setDaemon(true)
                .build());
  }

  /** Evaluates the job's rule and handles the results. The caller holds the job's run guard. */
  public EvalContext processJob(AlertJob job) {
    AlertRule rule = job.getRule();
    Instant evalTime = job.getEvalTime() == null ? clock.instant() : job.getEvalTime();
    EvalContext evalContext = evaluate(rule, evalTime, Map.of());
    LOGGER.debug(
        "Evaluated rule {} at {}: results:{} firing:{} noData:{} duration:{}",
        rule.getKey(),
        evalTime,
        evalContext.getResults().size(),
        evalContext.isFiring(),
        evalContext.isNoDataFound(),
        evalContext.getDuration());
    handleResults(rule, evalContext.getResults());
    return evalContext;
  }

  /**
   * Evaluates and handles a rule once, outside of any schedule. The job used here is never
   * registered with the scheduler.
   */
  public EvalContext handleRule(AlertRule rule, Instant evalTime) {
    AlertJob job = new AlertJob(rule);
    job.setEvalTime(evalTime);
    job.tryStart();
    try {
      return processJob(job);
    } finally {
      job.finish();
    }
  }

  /**
   * Runs only the bounded evaluation phase. Evaluation failures, including the deadline passing,
   * come back as a single Error result rather than an exception.
   */
  public EvalContext evaluate(AlertRule rule, Instant evalTime, Map<String, String> queryHeaders) {
    Instant start = clock.instant();
    Duration timeout = engineConfig.getEvaluationTimeout();
    EvaluationContext context =
        new EvaluationContext(rule.getOrgId(), evalTime, timeout, queryHeaders, clock);
    Future<List<EvaluationResult>> future =
        evaluationExecutor.submit(
            () -> conditionEvaluator.conditionEval(rule.getConditionModel(), evalTime, context));

    Throwable error = null;
    List<EvaluationResult> results = null;
    try {
      results = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      context.cancel();
      error = new EvaluationException("evaluation deadline exceeded", e);
    } catch (ExecutionException e) {
      error = e.getCause();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      context.cancel();
      error = new EvaluationException("evaluation interrupted", e);
    }

    Duration duration = Duration.between(start, clock.instant());
    evaluationTimer
        .computeIfAbsent(
            rule.getOrgId(),
            k ->
                Timer.builder(EVALUATION_TIMER)
                    .tag("orgId", String.valueOf(k))
                    .register(Metrics.globalRegistry))
        .record(duration.toMillis(), TimeUnit.MILLISECONDS);

    if (error != null) {
      LOGGER.error("Failed to evaluate rule {} at {}", rule.getKey(), evalTime, error);
      evaluationFailureCounter
          .computeIfAbsent(rule.getOrgId(), k -> counter(EVALUATION_FAILURE_COUNTER, k))
          .increment();
      results = List.of(EvaluationResult.error(error, evalTime, duration));
    }
    return EvalContext.builder()
        .rule(rule)
        .evalTime(evalTime)
        .results(results)
        .duration(duration)
        .error(error)
        .build();
  }

  private void handleResults(AlertRule rule, List<EvaluationResult> results) {
    Future<?> future =
        notificationExecutor.submit(
            () -> {
              resultHandler.handle(rule, results);
              return null;
            });
    try {
      future.get(engineConfig.getNotificationTimeout().toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      future.cancel(true);
      LOGGER.debug("Result handling of rule {} timed out", rule.getKey());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      LOGGER.debug("Result handling of rule {} interrupted", rule.getKey());
    } catch (ExecutionException e) {
      dispatchFailureCounter
          .computeIfAbsent(rule.getOrgId(), k -> counter(DISPATCH_FAILURE_COUNTER, k))
          .increment();
      if (e.getCause() instanceof AlertDispatchException) {
        LOGGER.error(
            "Failed to send alerts of rule {}: {}", rule.getKey(), e.getCause().getMessage());
      } else {
        LOGGER.error("Failed to handle results of rule {}", rule.getKey(), e.getCause());
      }
    }
  }

  private static Counter counter(String name, long orgId) {
    return Counter.builder(name).tag("orgId", String.valueOf(orgId)).register(Metrics.globalRegistry);
  }

  @Override
  public void close() {
    evaluationExecutor.shutdownNow();
    notificationExecutor.shutdownNow();
  }
}

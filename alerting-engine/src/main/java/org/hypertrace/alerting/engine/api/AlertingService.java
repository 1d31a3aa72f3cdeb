package org.hypertrace.alerting.engine.api;

import java.time.Instant;
import java.util.List;
import org.hypertrace.alerting.datamodel.AlertRule;
import org.hypertrace.alerting.datamodel.PostableAlerts;
import org.hypertrace.alerting.engine.AlertEvaluatorEngine;
import org.hypertrace.alerting.engine.EvalContext;
import org.hypertrace.alerting.evaluator.AlertConditionEvaluator;
import org.hypertrace.alerting.notification.service.AlertDeliveryException;
import org.hypertrace.alerting.notification.service.NoAlertmanagerForOrgException;
import org.hypertrace.alerting.notification.service.NotificationDispatcher;
import org.hypertrace.alerting.state.AlertState;
import org.hypertrace.alerting.state.StateManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** On-demand evaluate and process operations, independent of the rule schedule. */
public class AlertingService {
  private static final Logger LOGGER = LoggerFactory.getLogger(AlertingService.class);
  static final String NO_ALERTMANAGER_MESSAGE = "Alert manager for organization not found";

  private final AlertEvaluatorEngine engine;
  private final StateManager stateManager;
  private final NotificationDispatcher dispatcher;

  public AlertingService(
      AlertEvaluatorEngine engine, StateManager stateManager, NotificationDispatcher dispatcher) {
    this.engine = engine;
    this.stateManager = stateManager;
    this.dispatcher = dispatcher;
  }

  /** Evaluates a rule at the requested time; responds with the results, including errors. */
  public ApiResponse routeEvaluateAlert(AlertEvaluationRequest request) {
    AlertRule rule = request.getAlertRule();
    try {
      validateRule(rule);
    } catch (IllegalArgumentException e) {
      return ApiResponse.badRequest(String.format("invalid alert rule: %s", e.getMessage()));
    }
    Instant evalTime = request.getEvalTime() == null ? Instant.now() : request.getEvalTime();
    try {
      EvalContext evalContext = engine.evaluate(rule, evalTime, request.getQueryHeaders());
      return ApiResponse.ok(ApiConverters.toApi(evalContext.getResults()));
    } catch (RuntimeException e) {
      LOGGER.error("Failed to evaluate alert rule {}", rule.getKey(), e);
      return ApiResponse.error("failed to evaluate alert rule");
    }
  }

  /**
   * Folds the given results into state and sends the resulting alerts. Nothing is stored when the
   * rule's organization has no alertmanager.
   */
  public ApiResponse routeProcessAlert(AlertProcessRequest request) {
    AlertRule rule = request.getAlertRule();
    if (rule == null || rule.getUid() == null) {
      return ApiResponse.badRequest("invalid alert rule: missing rule or uid");
    }
    try {
      dispatcher.checkRoute(rule.getOrgId());
    } catch (NoAlertmanagerForOrgException e) {
      LOGGER.warn("No alertmanager for org {} of rule {}", rule.getOrgId(), rule.getUid());
      return ApiResponse.badRequest(NO_ALERTMANAGER_MESSAGE);
    }

    List<AlertState> states;
    try {
      states =
          stateManager.processEvalResults(
              rule, ApiConverters.fromApi(request.getEvaluationResults()));
    } catch (IllegalArgumentException e) {
      return ApiResponse.badRequest(
          String.format("invalid evaluation results: %s", e.getMessage()));
    }
    stateManager.saveAlertStates(states);
    PostableAlerts alerts;
    try {
      alerts = dispatcher.sendAlerts(rule.getOrgId(), states);
    } catch (NoAlertmanagerForOrgException e) {
      return ApiResponse.badRequest(NO_ALERTMANAGER_MESSAGE);
    } catch (AlertDeliveryException e) {
      return ApiResponse.error(String.format("failed to put alerts: %s", e.getMessage()));
    }
    return ApiResponse.ok(alerts);
  }

  private static void validateRule(AlertRule rule) {
    if (rule == null) {
      throw new IllegalArgumentException("missing alert rule");
    }
    AlertConditionEvaluator.validate(rule.getConditionModel());
  }
}

package org.hypertrace.alerting.notification.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Metrics;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.hypertrace.alerting.datamodel.EvalState;
import org.hypertrace.alerting.datamodel.Labels;
import org.hypertrace.alerting.datamodel.PostableAlert;
import org.hypertrace.alerting.datamodel.PostableAlerts;
import org.hypertrace.alerting.notification.service.alertmanager.Alertmanager;
import org.hypertrace.alerting.notification.service.alertmanager.MultiOrgAlertmanager;
import org.hypertrace.alerting.state.AlertState;
import org.hypertrace.alerting.state.StateManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Turns alert states into alertmanager alerts and hands them to the org's alertmanager. */
public class NotificationDispatcher {
  private static final Logger LOGGER = LoggerFactory.getLogger(NotificationDispatcher.class);

  public static final String VALUE_STRING_ANNOTATION = "__value_string__";
  public static final String RULE_NAME_ANNOTATION = "rulename";
  public static final String ERROR_ANNOTATION = "Error";
  public static final String NO_DATA_ALERT_NAME = "DatasourceNoData";
  public static final String ERROR_ALERT_NAME = "DatasourceError";

  private static final String ALERTS_SENT_COUNTER = "hypertrace.alerting.notification.alerts.sent";
  private static final String DELIVERY_FAILURE_COUNTER =
      "hypertrace.alerting.notification.delivery.failures";
  private static final ConcurrentMap<Long, Counter> alertsSentCounter = new ConcurrentHashMap<>();
  private static final ConcurrentMap<Long, Counter> deliveryFailureCounter =
      new ConcurrentHashMap<>();

  private final MultiOrgAlertmanager multiOrgAlertmanager;
  private final Optional<String> appUrl;

  public NotificationDispatcher(MultiOrgAlertmanager multiOrgAlertmanager, Optional<String> appUrl) {
    this.multiOrgAlertmanager = multiOrgAlertmanager;
    this.appUrl = appUrl;
  }

  /**
   * Sends the states that need sending to the org's alertmanager. They are recorded as sent at
   * their last evaluation time only once the alertmanager accepted them, so a failed delivery is
   * retried on the next evaluation.
   *
   * @return the alerts that were delivered
   */
  public PostableAlerts sendAlerts(long orgId, List<AlertState> states)
      throws NoAlertmanagerForOrgException, AlertDeliveryException {
    List<AlertState> toSend = new ArrayList<>();
    for (AlertState state : states) {
      if (state.needsSending(StateManager.RESEND_DELAY)) {
        toSend.add(state);
      }
    }
    if (toSend.isEmpty()) {
      return PostableAlerts.empty();
    }
    PostableAlerts alerts = fromAlertStateToPostableAlerts(toSend, appUrl);
    putAlerts(orgId, alerts);
    toSend.forEach(state -> state.markSent(state.getLastEvaluationTime()));
    return alerts;
  }

  public PostableAlerts fromAlertStateToPostableAlerts(List<AlertState> states) {
    return fromAlertStateToPostableAlerts(states, appUrl);
  }

  /** Converts the states that need sending. Nothing is recorded as sent. */
  public static PostableAlerts fromAlertStateToPostableAlerts(
      List<AlertState> states, Optional<String> appUrl) {
    List<PostableAlert> alerts = new ArrayList<>();
    for (AlertState state : states) {
      if (state.needsSending(StateManager.RESEND_DELAY)) {
        alerts.add(stateToPostableAlert(state, appUrl));
      }
    }
    return alerts.isEmpty() ? PostableAlerts.empty() : new PostableAlerts(List.copyOf(alerts));
  }

  /** Fails when {@code orgId} has no alertmanager to send to. */
  public void checkRoute(long orgId) throws NoAlertmanagerForOrgException {
    multiOrgAlertmanager.alertmanagerFor(orgId);
  }

  public void putAlerts(long orgId, PostableAlerts alerts)
      throws NoAlertmanagerForOrgException, AlertDeliveryException {
    Alertmanager alertmanager = multiOrgAlertmanager.alertmanagerFor(orgId);
    if (alerts.isEmpty()) {
      return;
    }
    try {
      alertmanager.putAlerts(alerts);
    } catch (AlertDeliveryException e) {
      deliveryFailureCounter
          .computeIfAbsent(orgId, k -> counter(DELIVERY_FAILURE_COUNTER, k))
          .increment();
      LOGGER.error("Failed to deliver {} alerts of org {}", alerts.size(), orgId, e);
      throw e;
    }
    alertsSentCounter
        .computeIfAbsent(orgId, k -> counter(ALERTS_SENT_COUNTER, k))
        .increment(alerts.size());
  }

  static PostableAlert stateToPostableAlert(AlertState state, Optional<String> appUrl) {
    Map<String, String> labels = new HashMap<>(state.getLabels().asMap());
    Map<String, String> annotations = new HashMap<>(state.getAnnotations());
    annotations.put(VALUE_STRING_ANNOTATION, state.getLastEvaluationString());

    if (state.getState() == EvalState.NoData || state.getState() == EvalState.Error) {
      annotations.put(
          RULE_NAME_ANNOTATION, state.getLabels().get(Labels.ALERT_NAME_LABEL).orElse(""));
      labels.put(
          Labels.ALERT_NAME_LABEL,
          state.getState() == EvalState.NoData ? NO_DATA_ALERT_NAME : ERROR_ALERT_NAME);
      if (state.getState() == EvalState.Error) {
        annotations.put(
            ERROR_ANNOTATION, state.getErrorOptional().map(Throwable::getMessage).orElse(""));
      }
    }

    return PostableAlert.builder()
        .labels(Map.copyOf(labels))
        .annotations(Map.copyOf(annotations))
        .startsAt(state.getStartsAt())
        .endsAt(state.getEndsAt())
        .generatorUrl(generatorUrl(state.getAlertRuleUid(), appUrl))
        .build();
  }

  private static String generatorUrl(String ruleUid, Optional<String> appUrl) {
    if (appUrl.isEmpty()) {
      return "";
    }
    if (ruleUid == null || ruleUid.isEmpty()) {
      return appUrl.get();
    }
    return String.format("%s/alerting/%s/edit", appUrl.get(), ruleUid);
  }

  private static Counter counter(String name, long orgId) {
    return Counter.builder(name).tag("orgId", String.valueOf(orgId)).register(Metrics.globalRegistry);
  }
}

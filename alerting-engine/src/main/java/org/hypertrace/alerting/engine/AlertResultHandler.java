package org.hypertrace.alerting.engine;

import java.util.List;
import org.hypertrace.alerting.datamodel.AlertRule;
import org.hypertrace.alerting.datamodel.EvaluationResult;
import org.hypertrace.alerting.datamodel.PostableAlerts;
import org.hypertrace.alerting.notification.service.AlertDispatchException;
import org.hypertrace.alerting.notification.service.NotificationDispatcher;
import org.hypertrace.alerting.state.AlertState;
import org.hypertrace.alerting.state.StateManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Folds results into state, persists it and sends whatever needs sending. */
public class AlertResultHandler implements ResultHandler {
  private static final Logger LOGGER = LoggerFactory.getLogger(AlertResultHandler.class);

  private final StateManager stateManager;
  private final NotificationDispatcher dispatcher;

  public AlertResultHandler(StateManager stateManager, NotificationDispatcher dispatcher) {
    this.stateManager = stateManager;
    this.dispatcher = dispatcher;
  }

  @Override
  public void handle(AlertRule rule, List<EvaluationResult> results)
      throws AlertDispatchException {
    List<AlertState> states = stateManager.processEvalResults(rule, results);
    stateManager.saveAlertStates(states);
    PostableAlerts alerts = dispatcher.sendAlerts(rule.getOrgId(), states);
    if (!alerts.isEmpty()) {
      LOGGER.debug("Sent {} alerts for rule {}", alerts.size(), rule.getKey());
    }
  }
}

package org.hypertrace.alerting.notification.service.alertmanager;

import org.hypertrace.alerting.datamodel.PostableAlerts;
import org.hypertrace.alerting.notification.service.AlertDeliveryException;
import org.hypertrace.alerting.notification.transport.AlertmanagerSender;
import org.hypertrace.alerting.notification.transport.NotificationTransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Alertmanager reached over HTTP. No retries: a failed post is reported to the caller. */
public class RemoteAlertmanager implements Alertmanager {
  private static final Logger LOGGER = LoggerFactory.getLogger(RemoteAlertmanager.class);

  private final AlertmanagerConfig config;
  private final AlertmanagerSender sender;

  public RemoteAlertmanager(AlertmanagerConfig config, AlertmanagerSender sender) {
    this.config = config;
    this.sender = sender;
  }

  @Override
  public long getOrgId() {
    return config.getOrgId();
  }

  @Override
  public void putAlerts(PostableAlerts alerts) throws AlertDeliveryException {
    if (alerts.isEmpty()) {
      return;
    }
    LOGGER.debug("Sending {} alerts of org {} to {}", alerts.size(), getOrgId(), config.getUrl());
    try {
      sender.send(config.getUrl(), config.getHeaders(), alerts.getPostableAlerts());
    } catch (NotificationTransportException e) {
      throw new AlertDeliveryException(
          String.format("failed to deliver alerts of org %d: %s", getOrgId(), e.getMessage()), e);
    }
  }

  @Override
  public void close() {
    LOGGER.info("Closing alertmanager of org {}", getOrgId());
  }
}

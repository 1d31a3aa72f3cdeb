package org.hypertrace.alerting.notification.service.alertmanager;

import org.hypertrace.alerting.datamodel.PostableAlerts;
import org.hypertrace.alerting.notification.service.AlertDeliveryException;

/** Alert routing endpoint of a single organization. */
public interface Alertmanager extends AutoCloseable {

  long getOrgId();

  void putAlerts(PostableAlerts alerts) throws AlertDeliveryException;

  @Override
  void close();
}

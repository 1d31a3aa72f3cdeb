package org.hypertrace.alerting.notification.service;

public class NoAlertmanagerForOrgException extends AlertDispatchException {
  private final long orgId;

  public NoAlertmanagerForOrgException(long orgId) {
    super(String.format("Alertmanager does not exist for this organization:%d", orgId));
    this.orgId = orgId;
  }

  public long getOrgId() {
    return orgId;
  }
}

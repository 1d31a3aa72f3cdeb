package org.hypertrace.alerting.datamodel;

import lombok.Value;

@Value
public class AlertRuleKey {
  long orgId;
  String uid;

  @Override
  public String toString() {
    return orgId + "/" + uid;
  }
}

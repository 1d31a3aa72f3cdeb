package org.hypertrace.alerting.datamodel;

/** Categorical state of an evaluation result or of an alert instance. */
public enum EvalState {
  Normal,
  Alerting,
  // only ever held by an alert instance waiting for the rule's "for" duration
  Pending,
  NoData,
  Error
}

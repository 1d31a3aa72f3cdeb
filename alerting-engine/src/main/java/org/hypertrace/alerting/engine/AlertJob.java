package org.hypertrace.alerting.engine;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicBoolean;
import org.hypertrace.alerting.datamodel.AlertRule;

/**
 * One schedulable evaluation of a rule. At most one cycle of a job runs at a time: a tick that
 * cannot {@link #tryStart()} is skipped, never queued.
 */
public class AlertJob {
  private final AtomicBoolean running = new AtomicBoolean(false);
  private volatile AlertRule rule;
  private volatile Instant evalTime;

  public AlertJob(AlertRule rule) {
    this.rule = rule;
  }

  public boolean tryStart() {
    return running.compareAndSet(false, true);
  }

  public void finish() {
    running.set(false);
  }

  public boolean isRunning() {
    return running.get();
  }

  public AlertRule getRule() {
    return rule;
  }

  /** Replaces the rule definition; picked up by the next cycle. */
  public void setRule(AlertRule rule) {
    this.rule = rule;
  }

  public Instant getEvalTime() {
    return evalTime;
  }

  public void setEvalTime(Instant evalTime) {
    this.evalTime = evalTime;
  }
}

package org.hypertrace.alerting.engine.job;

public class RuleEvaluationJobConstants {
  public static final String JOB_DATA_MAP_ALERT_JOB = "alertJob";
  public static final String JOB_DATA_MAP_ENGINE = "engine";
  public static final String JOB_DATA_MAP_JOB_MANAGER = "jobManager";
  public static final String ALERT_RULE_SOURCE = "alertRuleSource";

  public static final String JOB_GROUP = "alert-rules";
  public static final String TRIGGER_GROUP = "alert-rule-triggers";
  public static final String REFRESH_JOB_NAME = "alert-rule-refresh";
  public static final String REFRESH_JOB_GROUP = "alerting";

  public static final String JOB_CONFIG = "job.config";
  public static final String JOB_CONFIG_RULE_REFRESH_INTERVAL = "ruleRefreshInterval";
}

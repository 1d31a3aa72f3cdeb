package org.hypertrace.alerting.engine.job;

import static org.hypertrace.alerting.engine.job.RuleEvaluationJobConstants.ALERT_RULE_SOURCE;
import static org.hypertrace.alerting.engine.job.RuleEvaluationJobConstants.JOB_CONFIG;
import static org.hypertrace.alerting.engine.job.RuleEvaluationJobConstants.JOB_CONFIG_RULE_REFRESH_INTERVAL;
import static org.hypertrace.alerting.engine.job.RuleEvaluationJobConstants.JOB_DATA_MAP_ALERT_JOB;
import static org.hypertrace.alerting.engine.job.RuleEvaluationJobConstants.JOB_DATA_MAP_ENGINE;
import static org.hypertrace.alerting.engine.job.RuleEvaluationJobConstants.JOB_DATA_MAP_JOB_MANAGER;
import static org.hypertrace.alerting.engine.job.RuleEvaluationJobConstants.JOB_GROUP;
import static org.hypertrace.alerting.engine.job.RuleEvaluationJobConstants.REFRESH_JOB_GROUP;
import static org.hypertrace.alerting.engine.job.RuleEvaluationJobConstants.REFRESH_JOB_NAME;
import static org.hypertrace.alerting.engine.job.RuleEvaluationJobConstants.TRIGGER_GROUP;

import com.google.common.annotations.VisibleForTesting;
import com.typesafe.config.Config;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.hypertrace.alerting.datamodel.AlertRule;
import org.hypertrace.alerting.datamodel.AlertRuleKey;
import org.hypertrace.alerting.datamodel.rule.source.RuleSource;
import org.hypertrace.alerting.datamodel.rule.source.RuleSourceProvider;
import org.hypertrace.alerting.engine.AlertEvaluatorEngine;
import org.hypertrace.alerting.engine.AlertJob;
import org.hypertrace.alerting.state.StateManager;
import org.quartz.JobBuilder;
import org.quartz.JobDataMap;
import org.quartz.JobDetail;
import org.quartz.JobKey;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.SimpleScheduleBuilder;
import org.quartz.Trigger;
import org.quartz.TriggerBuilder;
import org.quartz.TriggerKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Keeps one Quartz job per alert rule, firing every {@code intervalSeconds} of the rule. */
public class RuleEvaluationJobManager implements JobManager {
  private static final Logger LOGGER = LoggerFactory.getLogger(RuleEvaluationJobManager.class);

  private final AlertEvaluatorEngine engine;
  private final StateManager stateManager;
  private final Map<AlertRuleKey, AlertJob> alertJobs = new ConcurrentHashMap<>();
  private RuleSource ruleSource;
  private Duration refreshInterval;

  public RuleEvaluationJobManager(AlertEvaluatorEngine engine, StateManager stateManager) {
    this.engine = engine;
    this.stateManager = stateManager;
  }

  @Override
  public void initJob(Config appConfig) {
    initJob(RuleSourceProvider.getProvider(appConfig.getConfig(ALERT_RULE_SOURCE)), appConfig);
  }

  @VisibleForTesting
  void initJob(RuleSource ruleSource, Config appConfig) {
    this.ruleSource = ruleSource;
    String refreshPath = JOB_CONFIG + "." + JOB_CONFIG_RULE_REFRESH_INTERVAL;
    this.refreshInterval = appConfig.hasPath(refreshPath) ? appConfig.getDuration(refreshPath) : null;
  }

  @Override
  public void startJob(Scheduler scheduler) throws SchedulerException {
    refreshRules(scheduler);
    if (refreshInterval != null) {
      JobDataMap jobDataMap = new JobDataMap();
      jobDataMap.put(JOB_DATA_MAP_JOB_MANAGER, this);
      JobDetail refreshJob =
          JobBuilder.newJob(RuleRefreshJob.class)
              .withIdentity(REFRESH_JOB_NAME, REFRESH_JOB_GROUP)
              .usingJobData(jobDataMap)
              .build();
      Trigger refreshTrigger =
          TriggerBuilder.newTrigger()
              .withIdentity(REFRESH_JOB_NAME, REFRESH_JOB_GROUP)
              .startAt(Date.from(Instant.now().plus(refreshInterval)))
              .withSchedule(
                  SimpleScheduleBuilder.simpleSchedule()
                      .withIntervalInMilliseconds(refreshInterval.toMillis())
                      .repeatForever())
              .build();
      LOGGER.info("Schedule rule refresh every {}", refreshInterval);
      scheduler.scheduleJob(refreshJob, refreshTrigger);
    }
  }

  @Override
  public void stopJob(Scheduler scheduler) throws SchedulerException {
    for (AlertRuleKey key : Set.copyOf(alertJobs.keySet())) {
      unschedule(scheduler, key);
    }
    JobKey refreshJobKey = JobKey.jobKey(REFRESH_JOB_NAME, REFRESH_JOB_GROUP);
    if (scheduler.checkExists(refreshJobKey)) {
      scheduler.deleteJob(refreshJobKey);
    }
  }

  /**
   * Reconciles scheduled jobs with the current rule definitions: new rules are scheduled,
   * removed ones unscheduled and changed ones take effect on their next tick. A failing rule
   * source leaves the current schedule untouched.
   */
  public synchronized void refreshRules(Scheduler scheduler) throws SchedulerException {
    List<AlertRule> rules;
    try {
      rules = ruleSource.getAllRules(rule -> true);
    } catch (IOException e) {
      LOGGER.error("Failed to read alert rules, keeping current schedule", e);
      return;
    }

    Set<AlertRuleKey> seen = new HashSet<>();
    for (AlertRule rule : rules) {
      if (!seen.add(rule.getKey())) {
        LOGGER.warn("Ignoring duplicate alert rule {}", rule.getKey());
        continue;
      }
      AlertJob existing = alertJobs.get(rule.getKey());
      if (existing == null) {
        schedule(scheduler, rule);
      } else if (!existing.getRule().equals(rule)) {
        long previousInterval = existing.getRule().getIntervalSeconds();
        existing.setRule(rule);
        if (previousInterval != rule.getIntervalSeconds()) {
          scheduler.rescheduleJob(triggerKey(rule.getKey()), trigger(rule));
        }
        LOGGER.info("Updated alert rule {}", rule.getKey());
      }
    }

    for (AlertRuleKey key : Set.copyOf(alertJobs.keySet())) {
      if (!seen.contains(key)) {
        unschedule(scheduler, key);
        stateManager.removeStatesForRule(key);
      }
    }
  }

  @Override
  public int scheduledJobCount() {
    return alertJobs.size();
  }

  public Optional<AlertJob> getAlertJob(AlertRuleKey key) {
    return Optional.ofNullable(alertJobs.get(key));
  }

  private void schedule(Scheduler scheduler, AlertRule rule) throws SchedulerException {
    AlertJob alertJob = new AlertJob(rule);
    JobDataMap jobDataMap = new JobDataMap();
    jobDataMap.put(JOB_DATA_MAP_ALERT_JOB, alertJob);
    jobDataMap.put(JOB_DATA_MAP_ENGINE, engine);

    JobDetail jobDetail =
        JobBuilder.newJob(RuleEvaluationJob.class)
            .withIdentity(jobKey(rule.getKey()))
            .usingJobData(jobDataMap)
            .build();
    Trigger trigger = trigger(rule);
    LOGGER.info("Schedule a job:{} with Trigger:{}", jobDetail.getKey(), trigger.getKey());
    scheduler.scheduleJob(jobDetail, trigger);
    alertJobs.put(rule.getKey(), alertJob);
  }

  private void unschedule(Scheduler scheduler, AlertRuleKey key) throws SchedulerException {
    alertJobs.remove(key);
    JobKey jobKey = jobKey(key);
    if (scheduler.checkExists(jobKey)) {
      scheduler.deleteJob(jobKey);
    }
    LOGGER.info("Unscheduled alert rule {}", key);
  }

  private static Trigger trigger(AlertRule rule) {
    long intervalSeconds = Math.max(1, rule.getIntervalSeconds());
    return TriggerBuilder.newTrigger()
        .withIdentity(triggerKey(rule.getKey()))
        .startAt(Date.from(Instant.now().plusSeconds(intervalSeconds)))
        .withSchedule(
            SimpleScheduleBuilder.simpleSchedule()
                .withIntervalInSeconds((int) intervalSeconds)
                .repeatForever()
                .withMisfireHandlingInstructionNextWithRemainingCount())
        .build();
  }

  @VisibleForTesting
  static JobKey jobKey(AlertRuleKey key) {
    return JobKey.jobKey(key.toString(), JOB_GROUP);
  }

  private static TriggerKey triggerKey(AlertRuleKey key) {
    return TriggerKey.triggerKey(key.toString(), TRIGGER_GROUP);
  }
}

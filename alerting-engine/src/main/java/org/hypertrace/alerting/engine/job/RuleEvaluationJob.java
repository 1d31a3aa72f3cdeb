package org.hypertrace.alerting.engine.job;

import static org.hypertrace.alerting.engine.job.RuleEvaluationJobConstants.JOB_DATA_MAP_ALERT_JOB;
import static org.hypertrace.alerting.engine.job.RuleEvaluationJobConstants.JOB_DATA_MAP_ENGINE;

import java.time.Instant;
import org.hypertrace.alerting.engine.AlertEvaluatorEngine;
import org.hypertrace.alerting.engine.AlertJob;
import org.quartz.Job;
import org.quartz.JobDataMap;
import org.quartz.JobDetail;
import org.quartz.JobExecutionContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Quartz entry point of one scheduled tick of one rule. */
public class RuleEvaluationJob implements Job {
  private static final Logger LOGGER = LoggerFactory.getLogger(RuleEvaluationJob.class);

  @Override
  public void execute(JobExecutionContext jobExecutionContext) {
    JobDetail jobDetail = jobExecutionContext.getJobDetail();
    JobDataMap jobDataMap = jobDetail.getJobDataMap();
    AlertJob alertJob = (AlertJob) jobDataMap.get(JOB_DATA_MAP_ALERT_JOB);
    AlertEvaluatorEngine engine = (AlertEvaluatorEngine) jobDataMap.get(JOB_DATA_MAP_ENGINE);

    Instant fireTime =
        jobExecutionContext.getScheduledFireTime() == null
            ? Instant.now()
            : jobExecutionContext.getScheduledFireTime().toInstant();
    run(alertJob, engine, fireTime);
  }

  /** Runs a cycle unless the previous one of the same job is still going. */
  static boolean run(AlertJob alertJob, AlertEvaluatorEngine engine, Instant evalTime) {
    if (!alertJob.tryStart()) {
      LOGGER.debug(
          "Skipping tick at {} of rule {}: previous evaluation still running",
          evalTime,
          alertJob.getRule().getKey());
      return false;
    }
    try {
      alertJob.setEvalTime(evalTime);
      engine.processJob(alertJob);
      return true;
    } finally {
      alertJob.finish();
    }
  }
}

package org.hypertrace.alerting.engine.job;

import static org.hypertrace.alerting.engine.job.RuleEvaluationJobConstants.JOB_DATA_MAP_JOB_MANAGER;

import org.quartz.DisallowConcurrentExecution;
import org.quartz.Job;
import org.quartz.JobExecutionContext;
import org.quartz.SchedulerException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Periodically reloads rule definitions and reconciles the scheduled rule jobs. */
@DisallowConcurrentExecution
public class RuleRefreshJob implements Job {
  private static final Logger LOGGER = LoggerFactory.getLogger(RuleRefreshJob.class);

  @Override
  public void execute(JobExecutionContext jobExecutionContext) {
    RuleEvaluationJobManager jobManager =
        (RuleEvaluationJobManager)
            jobExecutionContext.getJobDetail().getJobDataMap().get(JOB_DATA_MAP_JOB_MANAGER);
    try {
      jobManager.refreshRules(jobExecutionContext.getScheduler());
    } catch (SchedulerException e) {
      LOGGER.error("Failed to refresh alert rules", e);
    }
  }
}

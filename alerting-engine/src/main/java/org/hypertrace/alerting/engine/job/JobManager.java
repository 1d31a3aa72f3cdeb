package org.hypertrace.alerting.engine.job;

import com.typesafe.config.Config;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;

/** Owns a family of Quartz jobs of the alerting engine, from configuration to teardown. */
public interface JobManager {
  /** Reads what the jobs need from the application config. Nothing is scheduled yet. */
  void initJob(Config appConfig);

  void startJob(Scheduler scheduler) throws SchedulerException;

  /** Deletes every job this manager scheduled. */
  void stopJob(Scheduler scheduler) throws SchedulerException;

  int scheduledJobCount();
}

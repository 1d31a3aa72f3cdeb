package org.hypertrace.alerting.engine;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import java.io.IOException;
import java.time.Clock;
import org.hypertrace.alerting.engine.api.AlertingApi;
import org.hypertrace.alerting.engine.api.AlertingService;
import org.hypertrace.alerting.engine.job.JobManager;
import org.hypertrace.alerting.engine.job.RuleEvaluationJobManager;
import org.hypertrace.alerting.evaluator.AlertConditionEvaluator;
import org.hypertrace.alerting.notification.service.NotificationDispatcher;
import org.hypertrace.alerting.notification.service.alertmanager.AlertmanagerConfigReader;
import org.hypertrace.alerting.notification.service.alertmanager.MultiOrgAlertmanager;
import org.hypertrace.alerting.notification.service.alertmanager.RemoteAlertmanager;
import org.hypertrace.alerting.notification.transport.AlertmanagerSender;
import org.hypertrace.alerting.notification.transport.NotificationConfig;
import org.hypertrace.alerting.notification.transport.http.HttpWithJsonSender;
import org.hypertrace.alerting.state.StateManager;
import org.hypertrace.alerting.state.store.InMemoryInstanceStore;
import org.quartz.Scheduler;
import org.quartz.SchedulerException;
import org.quartz.impl.StdSchedulerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Wires the engine components once and drives their lifecycle. */
public class AlertingEngineService {
  private static final Logger LOGGER = LoggerFactory.getLogger(AlertingEngineService.class);

  private final Config appConfig;
  private final Clock clock;
  private Scheduler scheduler;
  private JobManager jobManager;
  private MultiOrgAlertmanager multiOrgAlertmanager;
  private AlertEvaluatorEngine engine;
  private AlertingApi alertingApi;

  public AlertingEngineService(Config appConfig, Clock clock) {
    this.appConfig = appConfig;
    this.clock = clock;
  }

  public void init() {
    try {
      AlertmanagerSender sender = new AlertmanagerSender(HttpWithJsonSender.getInstance());
      multiOrgAlertmanager =
          new MultiOrgAlertmanager(config -> new RemoteAlertmanager(config, sender));
      multiOrgAlertmanager.syncAlertmanagersForOrgs(
          new AlertmanagerConfigReader(appConfig).readAlertmanagerConfigs());

      StateManager stateManager = new StateManager(new InMemoryInstanceStore(), clock);
      NotificationDispatcher dispatcher =
          new NotificationDispatcher(
              multiOrgAlertmanager, NotificationConfig.from(appConfig).getAppUrl());
      engine =
          new AlertEvaluatorEngine(
              new AlertConditionEvaluator(appConfig, clock),
              new AlertResultHandler(stateManager, dispatcher),
              EngineConfig.from(appConfig),
              clock);
      alertingApi = new AlertingApi(new AlertingService(engine, stateManager, dispatcher));

      scheduler = new StdSchedulerFactory().getScheduler();
      jobManager = new RuleEvaluationJobManager(engine, stateManager);
      jobManager.initJob(appConfig);
    } catch (IOException | SchedulerException e) {
      throw new RuntimeException(e);
    }
  }

  public void start() {
    try {
      jobManager.startJob(scheduler);
      scheduler.start();
      LOGGER.info("Alerting engine started with {} alert rules", jobManager.scheduledJobCount());
    } catch (SchedulerException e) {
      throw new RuntimeException(e);
    }
  }

  public void stop() {
    try {
      jobManager.stopJob(scheduler);
      scheduler.shutdown();
    } catch (SchedulerException e) {
      throw new RuntimeException(e);
    } finally {
      engine.close();
      multiOrgAlertmanager.stop();
      LOGGER.info("Alerting engine stopped");
    }
  }

  public AlertingApi getAlertingApi() {
    return alertingApi;
  }

  public static void main(String[] args) {
    AlertingEngineService service =
        new AlertingEngineService(ConfigFactory.load(), Clock.systemUTC());
    service.init();
    Runtime.getRuntime().addShutdownHook(new Thread(service::stop, "alerting-engine-shutdown"));
    service.start();
  }
}

package org.hypertrace.alerting.engine;

import com.typesafe.config.Config;
import java.time.Duration;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class EngineConfig {
  static final String JOB_CONFIG = "job.config";
  private static final String EVALUATION_TIMEOUT = "evaluationTimeout";
  private static final String NOTIFICATION_TIMEOUT = "notificationTimeout";
  private static final String EVALUATION_THREADS = "evaluationThreads";
  private static final String NOTIFICATION_THREADS = "notificationThreads";
  private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);
  private static final int DEFAULT_THREADS = 4;

  @Builder.Default Duration evaluationTimeout = DEFAULT_TIMEOUT;
  @Builder.Default Duration notificationTimeout = DEFAULT_TIMEOUT;
  @Builder.Default int evaluationThreads = DEFAULT_THREADS;
  @Builder.Default int notificationThreads = DEFAULT_THREADS;

  public static EngineConfig from(Config appConfig) {
    EngineConfigBuilder builder = EngineConfig.builder();
    if (!appConfig.hasPath(JOB_CONFIG)) {
      return builder.build();
    }
    Config jobConfig = appConfig.getConfig(JOB_CONFIG);
    if (jobConfig.hasPath(EVALUATION_TIMEOUT)) {
      builder.evaluationTimeout(jobConfig.getDuration(EVALUATION_TIMEOUT));
    }
    if (jobConfig.hasPath(NOTIFICATION_TIMEOUT)) {
      builder.notificationTimeout(jobConfig.getDuration(NOTIFICATION_TIMEOUT));
    }
    if (jobConfig.hasPath(EVALUATION_THREADS)) {
      builder.evaluationThreads(jobConfig.getInt(EVALUATION_THREADS));
    }
    if (jobConfig.hasPath(NOTIFICATION_THREADS)) {
      builder.notificationThreads(jobConfig.getInt(NOTIFICATION_THREADS));
    }
    return builder.build();
  }
}

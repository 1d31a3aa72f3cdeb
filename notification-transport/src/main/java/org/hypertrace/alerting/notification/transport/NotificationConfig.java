package org.hypertrace.alerting.notification.transport;

import com.typesafe.config.Config;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class NotificationConfig {
  private static final Logger LOGGER = LoggerFactory.getLogger(NotificationConfig.class);
  private static final String NOTIFICATION_CONFIG = "notification.config";
  private static final String APP_URL = "app.url";

  private final String appUrl;

  public static NotificationConfig from(Config config) {
    if (!config.hasPath(NOTIFICATION_CONFIG)) {
      return new NotificationConfig(null);
    }
    Config notificationConfig = config.getConfig(NOTIFICATION_CONFIG);
    return new NotificationConfig(
        notificationConfig.hasPath(APP_URL) ? notificationConfig.getString(APP_URL) : null);
  }

  NotificationConfig(String appUrl) {
    this.appUrl = validate(appUrl);
  }

  /** Base URL of the alerting UI, used for generator URLs. Empty when unset or unparseable. */
  public Optional<String> getAppUrl() {
    return Optional.ofNullable(appUrl);
  }

  private static String validate(String appUrl) {
    if (appUrl == null || appUrl.isEmpty()) {
      return null;
    }
    try {
      URI uri = new URI(appUrl);
      if (uri.getScheme() == null || uri.getHost() == null) {
        throw new URISyntaxException(appUrl, "scheme and host are required");
      }
    } catch (URISyntaxException e) {
      LOGGER.error("Ignoring invalid application url: {}", appUrl, e);
      return null;
    }
    return appUrl.endsWith("/") ? appUrl.substring(0, appUrl.length() - 1) : appUrl;
  }
}

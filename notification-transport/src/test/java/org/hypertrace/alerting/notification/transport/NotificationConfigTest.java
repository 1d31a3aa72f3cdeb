package org.hypertrace.alerting.notification.transport;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class NotificationConfigTest {

  @Test
  void testAppUrl() {
    NotificationConfig config =
        NotificationConfig.from(
            ConfigFactory.parseString("notification.config.app.url = \"http://grafana:3000/\""));
    Assertions.assertEquals("http://grafana:3000", config.getAppUrl().orElseThrow());
  }

  @Test
  void testMissingOrInvalidAppUrl() {
    Assertions.assertTrue(NotificationConfig.from(ConfigFactory.empty()).getAppUrl().isEmpty());
    Assertions.assertTrue(
        NotificationConfig.from(
                ConfigFactory.parseString("notification.config.app.url = \"not a url\""))
            .getAppUrl()
            .isEmpty());
  }
}

package org.hypertrace.alerting.notification.service.alertmanager;

import com.typesafe.config.ConfigFactory;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class AlertmanagerConfigReaderTest {

  @Test
  void testReadFromConfigList() throws IOException {
    List<AlertmanagerConfig> configs =
        new AlertmanagerConfigReader(
                ConfigFactory.parseString(
                    "alertmanagers = [\n"
                        + "  { orgId = 1, url = \"http://am:9093\", headers { \"X-Scope-OrgID\" = t1 } }\n"
                        + "]"))
            .readAlertmanagerConfigs();

    Assertions.assertEquals(1, configs.size());
    Assertions.assertEquals(1L, configs.get(0).getOrgId());
    Assertions.assertEquals("http://am:9093", configs.get(0).getUrl());
    Assertions.assertEquals(Map.of("X-Scope-OrgID", "t1"), configs.get(0).getHeaders());
  }

  @Test
  void testReadFromFile() throws IOException {
    String path = getClass().getClassLoader().getResource("alertmanagers.json").getPath();

    List<AlertmanagerConfig> configs =
        new AlertmanagerConfigReader(
                ConfigFactory.parseString(
                    "alertmanagersSource { type = fs, fs.path = \"" + path + "\" }"))
            .readAlertmanagerConfigs();

    Assertions.assertEquals(2, configs.size());
    Assertions.assertEquals("tenant-1", configs.get(0).getHeaders().get("X-Scope-OrgID"));
    Assertions.assertTrue(configs.get(1).getHeaders().isEmpty());
  }

  @Test
  void testMissingConfigYieldsNoAlertmanagers() throws IOException {
    Assertions.assertTrue(
        new AlertmanagerConfigReader(ConfigFactory.empty()).readAlertmanagerConfigs().isEmpty());
  }

  @Test
  void testInvalidSourceType() {
    Assertions.assertThrows(
        RuntimeException.class,
        () ->
            new AlertmanagerConfigReader(
                ConfigFactory.parseString("alertmanagersSource.type = dataStore")));
  }
}

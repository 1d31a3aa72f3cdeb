package org.hypertrace.alerting.evaluator.datasource;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class DataSourceRegistryTest {

  @Test
  void testReadFromConfig() {
    Config config =
        ConfigFactory.parseString(
            "datasources = [\n"
                + "  { uid = prom-1, type = prometheus, url = \"http://prometheus:9090\",\n"
                + "    headers { \"X-Account-Token\" = abc } }\n"
                + "  { uid = prom-2, type = prometheus, url = \"http://other:9090\" }\n"
                + "]");

    DataSourceRegistry registry = DataSourceRegistry.from(config);

    Assertions.assertEquals(2, registry.getAll().size());
    DataSource dataSource = registry.get("prom-1").orElseThrow();
    Assertions.assertEquals("http://prometheus:9090", dataSource.getUrl());
    Assertions.assertEquals("abc", dataSource.getHeaders().get("X-Account-Token"));
    Assertions.assertTrue(registry.get("prom-2").orElseThrow().getHeaders().isEmpty());
    Assertions.assertTrue(registry.get("unknown").isEmpty());
  }

  @Test
  void testMissingSectionYieldsEmptyRegistry() {
    Assertions.assertTrue(
        DataSourceRegistry.from(ConfigFactory.empty()).getAll().isEmpty());
  }
}

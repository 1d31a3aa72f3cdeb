package org.hypertrace.alerting.evaluator.datasource;

import com.typesafe.config.Config;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Data sources known to the evaluator, keyed by uid. */
public class DataSourceRegistry {
  static final String DATASOURCES_CONFIG_KEY = "datasources";
  private static final String UID = "uid";
  private static final String TYPE = "type";
  private static final String URL = "url";
  private static final String HEADERS = "headers";

  private final Map<String, DataSource> dataSources = new ConcurrentHashMap<>();

  public static DataSourceRegistry from(Config appConfig) {
    DataSourceRegistry registry = new DataSourceRegistry();
    if (!appConfig.hasPath(DATASOURCES_CONFIG_KEY)) {
      return registry;
    }
    for (Config dataSourceConfig : appConfig.getConfigList(DATASOURCES_CONFIG_KEY)) {
      Map<String, String> headers = new HashMap<>();
      if (dataSourceConfig.hasPath(HEADERS)) {
        Config headersConfig = dataSourceConfig.getConfig(HEADERS);
        headersConfig
            .root()
            .keySet()
            .forEach(key -> headers.put(key, headersConfig.getString("\"" + key + "\"")));
      }
      registry.register(
          DataSource.builder()
              .uid(dataSourceConfig.getString(UID))
              .type(dataSourceConfig.getString(TYPE))
              .url(dataSourceConfig.getString(URL))
              .headers(Map.copyOf(headers))
              .build());
    }
    return registry;
  }

  public void register(DataSource dataSource) {
    dataSources.put(dataSource.getUid(), dataSource);
  }

  public Optional<DataSource> get(String uid) {
    return Optional.ofNullable(dataSources.get(uid));
  }

  public Collection<DataSource> getAll() {
    return dataSources.values();
  }
}

package org.hypertrace.alerting.notification.service.alertmanager;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.typesafe.config.Config;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads per-org alertmanager configs, either inline from the {@code alertmanagers} list or from a
 * JSON file named by {@code alertmanagersSource}.
 */
public class AlertmanagerConfigReader {
  private static final Logger LOGGER = LoggerFactory.getLogger(AlertmanagerConfigReader.class);
  public static final String ALERTMANAGERS = "alertmanagers";
  public static final String ALERTMANAGERS_SOURCE = "alertmanagersSource";
  private static final String SOURCE_TYPE = "type";
  private static final String SOURCE_TYPE_FS = "fs";
  private static final String SOURCE_TYPE_CONFIG = "config";
  private static final String FS_PATH = "path";
  private static final String ORG_ID = "orgId";
  private static final String URL = "url";
  private static final String HEADERS = "headers";
  private static final ObjectMapper OBJECT_MAPPER =
      new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private final Config appConfig;
  private final String sourceType;

  public AlertmanagerConfigReader(Config appConfig) {
    this.appConfig = appConfig;
    this.sourceType =
        appConfig.hasPath(ALERTMANAGERS_SOURCE + "." + SOURCE_TYPE)
            ? appConfig.getString(ALERTMANAGERS_SOURCE + "." + SOURCE_TYPE)
            : SOURCE_TYPE_CONFIG;
    if (!SOURCE_TYPE_CONFIG.equals(sourceType) && !SOURCE_TYPE_FS.equals(sourceType)) {
      throw new RuntimeException(
          String.format("Invalid alertmanager source type:%s", sourceType));
    }
  }

  public List<AlertmanagerConfig> readAlertmanagerConfigs() throws IOException {
    if (SOURCE_TYPE_FS.equals(sourceType)) {
      return readFromFs(
          appConfig.getConfig(ALERTMANAGERS_SOURCE).getConfig(SOURCE_TYPE_FS).getString(FS_PATH));
    }
    return readFromConfig();
  }

  private List<AlertmanagerConfig> readFromConfig() {
    if (!appConfig.hasPath(ALERTMANAGERS)) {
      return List.of();
    }
    List<AlertmanagerConfig> configs = new ArrayList<>();
    for (Config config : appConfig.getConfigList(ALERTMANAGERS)) {
      Map<String, String> headers = new HashMap<>();
      if (config.hasPath(HEADERS)) {
        Config headersConfig = config.getConfig(HEADERS);
        headersConfig
            .root()
            .keySet()
            .forEach(key -> headers.put(key, headersConfig.getString("\"" + key + "\"")));
      }
      configs.add(
          AlertmanagerConfig.builder()
              .orgId(config.getLong(ORG_ID))
              .url(config.getString(URL))
              .headers(Map.copyOf(headers))
              .build());
    }
    return configs;
  }

  private List<AlertmanagerConfig> readFromFs(String fsPath) throws IOException {
    LOGGER.debug("Reading alertmanager configs from file path:{}", fsPath);
    JsonNode jsonNode = OBJECT_MAPPER.readTree(new File(fsPath).getAbsoluteFile());
    if (!jsonNode.isArray()) {
      throw new IOException("File should contain an array of alertmanager configs");
    }
    List<AlertmanagerConfig> configs = new ArrayList<>();
    for (JsonNode node : jsonNode) {
      if (!node.hasNonNull(ORG_ID) || !node.hasNonNull(URL)) {
        LOGGER.error("Skipping alertmanager config without orgId or url: {}", node);
        continue;
      }
      configs.add(OBJECT_MAPPER.treeToValue(node, AlertmanagerConfig.class));
    }
    return configs;
  }
}

package org.hypertrace.alerting.datamodel.rule.source;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.typesafe.config.Config;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import org.hypertrace.alerting.datamodel.AlertRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Reads alert rule definitions from a JSON file holding an array of rules. */
public class FSRuleSource implements RuleSource {
  private static final Logger LOGGER = LoggerFactory.getLogger(FSRuleSource.class);
  private static final String PATH_CONFIG = "path";
  private static final ObjectMapper OBJECT_MAPPER =
      new ObjectMapper()
          .registerModule(new JavaTimeModule())
          .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private final Config fsConfig;

  public FSRuleSource(Config fsConfig) {
    this.fsConfig = fsConfig;
  }

  public List<AlertRule> getAllRules(Predicate<AlertRule> predicate) throws IOException {
    return readRules(fsConfig.getString(PATH_CONFIG)).stream()
        .filter(predicate)
        .collect(Collectors.toUnmodifiableList());
  }

  private List<AlertRule> readRules(String fsPath) throws IOException {
    LOGGER.debug("Reading rules from file path:{}", fsPath);
    JsonNode jsonNode = OBJECT_MAPPER.readTree(new File(fsPath).getAbsoluteFile());
    if (!jsonNode.isArray()) {
      throw new IOException("File should contain an array of alert rules");
    }

    List<AlertRule> rules = new ArrayList<>();
    for (JsonNode ruleNode : jsonNode) {
      try {
        rules.add(OBJECT_MAPPER.treeToValue(ruleNode, AlertRule.class));
      } catch (IOException | IllegalArgumentException e) {
        LOGGER.error("Skipping invalid alert rule {}", ruleNode, e);
      }
    }
    return rules;
  }
}

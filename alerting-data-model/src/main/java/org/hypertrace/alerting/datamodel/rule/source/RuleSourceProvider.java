package org.hypertrace.alerting.datamodel.rule.source;

import com.typesafe.config.Config;

/** Creates the {@link RuleSource} described by an {@code alertRuleSource} block; fs by default. */
public class RuleSourceProvider {
  private static final String TYPE_CONFIG = "type";
  private static final String FS_TYPE = "fs";

  public static RuleSource getProvider(Config ruleSourceConfig) {
    String type =
        ruleSourceConfig.hasPath(TYPE_CONFIG) ? ruleSourceConfig.getString(TYPE_CONFIG) : FS_TYPE;
    if (FS_TYPE.equals(type)) {
      return new FSRuleSource(ruleSourceConfig.getConfig(FS_TYPE));
    }
    throw new RuntimeException(String.format("Invalid alert rule source type:%s", type));
  }
}

package org.hypertrace.alerting.datamodel.rule.source;

import java.io.IOException;
import java.util.List;
import java.util.function.Predicate;
import org.hypertrace.alerting.datamodel.AlertRule;

public interface RuleSource {
  List<AlertRule> getAllRules(Predicate<AlertRule> predicate) throws IOException;
}

package org.hypertrace.alerting.state.store;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.hypertrace.alerting.datamodel.AlertInstance;
import org.hypertrace.alerting.datamodel.AlertRuleKey;
import org.hypertrace.alerting.datamodel.SaveAlertInstanceCommand;

public class InMemoryInstanceStore implements InstanceStore {
  private final Map<AlertRuleKey, Map<String, AlertInstance>> instances = new ConcurrentHashMap<>();

  @Override
  public void saveAlertInstance(SaveAlertInstanceCommand command) throws PersistenceException {
    if (command.getRuleUid() == null || command.getLabels() == null) {
      throw new PersistenceException("alert instance requires a rule uid and labels");
    }
    AlertInstance instance = AlertInstance.from(command);
    instances
        .computeIfAbsent(
            new AlertRuleKey(command.getRuleOrgId(), command.getRuleUid()),
            k -> new ConcurrentHashMap<>())
        .put(instance.getLabelsHash(), instance);
  }

  @Override
  public List<AlertInstance> listAlertInstances(long orgId, String ruleUid) {
    return instances.getOrDefault(new AlertRuleKey(orgId, ruleUid), Map.of()).values().stream()
        .collect(Collectors.toList());
  }
}

package org.hypertrace.alerting.state.store;

import java.util.List;
import org.hypertrace.alerting.datamodel.AlertInstance;
import org.hypertrace.alerting.datamodel.SaveAlertInstanceCommand;

/** Storage of alert instance state, keyed by rule and label fingerprint. */
public interface InstanceStore {

  /** Inserts or replaces the instance identified by the command's rule and labels. */
  void saveAlertInstance(SaveAlertInstanceCommand command) throws PersistenceException;

  List<AlertInstance> listAlertInstances(long orgId, String ruleUid) throws PersistenceException;
}

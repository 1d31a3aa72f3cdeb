package org.hypertrace.alerting.notification.service.alertmanager;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import org.hypertrace.alerting.notification.service.NoAlertmanagerForOrgException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Registry of the alertmanager serving each organization. */
public class MultiOrgAlertmanager {
  private static final Logger LOGGER = LoggerFactory.getLogger(MultiOrgAlertmanager.class);

  private final Map<Long, Alertmanager> alertmanagers = new ConcurrentHashMap<>();
  private final Map<Long, AlertmanagerConfig> configs = new ConcurrentHashMap<>();
  private final Function<AlertmanagerConfig, Alertmanager> alertmanagerFactory;

  public MultiOrgAlertmanager(Function<AlertmanagerConfig, Alertmanager> alertmanagerFactory) {
    this.alertmanagerFactory = alertmanagerFactory;
  }

  /**
   * Brings the registry in line with {@code orgConfigs}: new orgs get an alertmanager, changed
   * configs replace theirs and orgs no longer listed are closed and removed.
   */
  public synchronized void syncAlertmanagersForOrgs(List<AlertmanagerConfig> orgConfigs) {
    Set<Long> seen = new HashSet<>();
    for (AlertmanagerConfig config : orgConfigs) {
      if (!seen.add(config.getOrgId())) {
        LOGGER.warn("Ignoring duplicate alertmanager config for org {}", config.getOrgId());
        continue;
      }
      AlertmanagerConfig existing = configs.get(config.getOrgId());
      if (config.equals(existing)) {
        continue;
      }
      Alertmanager previous = alertmanagers.put(config.getOrgId(), alertmanagerFactory.apply(config));
      configs.put(config.getOrgId(), config);
      if (previous != null) {
        previous.close();
      }
      LOGGER.info(
          "{} alertmanager for org {}", previous == null ? "Created" : "Replaced", config.getOrgId());
    }

    for (Long orgId : Set.copyOf(alertmanagers.keySet())) {
      if (!seen.contains(orgId)) {
        configs.remove(orgId);
        Alertmanager removed = alertmanagers.remove(orgId);
        if (removed != null) {
          removed.close();
        }
        LOGGER.info("Removed alertmanager for org {}", orgId);
      }
    }
  }

  public Alertmanager alertmanagerFor(long orgId) throws NoAlertmanagerForOrgException {
    Alertmanager alertmanager = alertmanagers.get(orgId);
    if (alertmanager == null) {
      throw new NoAlertmanagerForOrgException(orgId);
    }
    return alertmanager;
  }

  public synchronized void stop() {
    alertmanagers.values().forEach(Alertmanager::close);
    alertmanagers.clear();
    configs.clear();
  }
}

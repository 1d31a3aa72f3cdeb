package org.hypertrace.alerting.notification.service.alertmanager;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.util.ArrayList;
import java.util.List;
import org.hypertrace.alerting.notification.service.NoAlertmanagerForOrgException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class MultiOrgAlertmanagerTest {
  private List<Alertmanager> created;
  private MultiOrgAlertmanager multiOrgAlertmanager;

  @BeforeEach
  void setUp() {
    created = new ArrayList<>();
    multiOrgAlertmanager =
        new MultiOrgAlertmanager(
            config -> {
              Alertmanager alertmanager = mock(Alertmanager.class);
              created.add(alertmanager);
              return alertmanager;
            });
  }

  @Test
  void testSyncCreatesReplacesAndRemoves() throws NoAlertmanagerForOrgException {
    AlertmanagerConfig org1 = AlertmanagerConfig.builder().orgId(1L).url("http://am-1").build();
    AlertmanagerConfig org2 = AlertmanagerConfig.builder().orgId(2L).url("http://am-2").build();

    multiOrgAlertmanager.syncAlertmanagersForOrgs(List.of(org1, org2));
    Assertions.assertEquals(2, created.size());
    Alertmanager first = multiOrgAlertmanager.alertmanagerFor(1L);

    // unchanged configs keep their instance
    multiOrgAlertmanager.syncAlertmanagersForOrgs(List.of(org1, org2));
    Assertions.assertEquals(2, created.size());
    Assertions.assertSame(first, multiOrgAlertmanager.alertmanagerFor(1L));

    AlertmanagerConfig org1Changed = org1.toBuilder().url("http://am-1b").build();
    multiOrgAlertmanager.syncAlertmanagersForOrgs(List.of(org1Changed));

    verify(first).close();
    verify(created.get(1)).close();
    Assertions.assertNotSame(first, multiOrgAlertmanager.alertmanagerFor(1L));
    Assertions.assertThrows(
        NoAlertmanagerForOrgException.class, () -> multiOrgAlertmanager.alertmanagerFor(2L));
  }

  @Test
  void testStopClosesAll() {
    multiOrgAlertmanager.syncAlertmanagersForOrgs(
        List.of(AlertmanagerConfig.builder().orgId(1L).url("http://am-1").build()));
    Alertmanager alertmanager = created.get(0);
    verify(alertmanager, never()).close();

    multiOrgAlertmanager.stop();

    verify(alertmanager).close();
    Assertions.assertThrows(
        NoAlertmanagerForOrgException.class, () -> multiOrgAlertmanager.alertmanagerFor(1L));
  }
}

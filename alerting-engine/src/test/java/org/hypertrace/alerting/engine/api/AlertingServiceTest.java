package org.hypertrace.alerting.engine.api;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.hypertrace.alerting.datamodel.AlertQuery;
import org.hypertrace.alerting.datamodel.AlertRule;
import org.hypertrace.alerting.datamodel.EvalState;
import org.hypertrace.alerting.datamodel.EvaluationResult;
import org.hypertrace.alerting.datamodel.Labels;
import org.hypertrace.alerting.datamodel.PostableAlerts;
import org.hypertrace.alerting.engine.AlertEvaluatorEngine;
import org.hypertrace.alerting.engine.AlertResultHandler;
import org.hypertrace.alerting.engine.EngineConfig;
import org.hypertrace.alerting.evaluator.ConditionEvaluator;
import org.hypertrace.alerting.evaluator.QueryException;
import org.hypertrace.alerting.notification.service.NotificationDispatcher;
import org.hypertrace.alerting.notification.service.alertmanager.AlertmanagerConfig;
import org.hypertrace.alerting.notification.service.alertmanager.MultiOrgAlertmanager;
import org.hypertrace.alerting.notification.service.alertmanager.RemoteAlertmanager;
import org.hypertrace.alerting.notification.transport.AlertmanagerSender;
import org.hypertrace.alerting.notification.transport.http.HttpWithJsonSender;
import org.hypertrace.alerting.state.AlertState;
import org.hypertrace.alerting.state.StateManager;
import org.hypertrace.alerting.state.store.InstanceStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class AlertingServiceTest {
  private static final Instant T0 = Instant.parse("2022-10-01T10:00:00Z");

  private MockWebServer mockWebServer;
  private MultiOrgAlertmanager multiOrgAlertmanager;
  private InstanceStore instanceStore;
  private StateManager stateManager;
  private ConditionEvaluator conditionEvaluator;
  private AlertEvaluatorEngine engine;
  private AlertingService alertingService;

  @BeforeEach
  void setUp() throws IOException {
    mockWebServer = new MockWebServer();
    mockWebServer.start();
    AlertmanagerSender sender = new AlertmanagerSender(new HttpWithJsonSender(new OkHttpClient()));
    multiOrgAlertmanager =
        new MultiOrgAlertmanager(config -> new RemoteAlertmanager(config, sender));
    multiOrgAlertmanager.syncAlertmanagersForOrgs(
        List.of(
            AlertmanagerConfig.builder()
                .orgId(1L)
                .url(mockWebServer.url("/").toString())
                .build()));
    instanceStore = mock(InstanceStore.class);
    stateManager = new StateManager(instanceStore, Clock.fixed(T0, ZoneOffset.UTC));
    NotificationDispatcher dispatcher =
        new NotificationDispatcher(multiOrgAlertmanager, Optional.empty());
    conditionEvaluator = mock(ConditionEvaluator.class);
    engine =
        new AlertEvaluatorEngine(
            conditionEvaluator,
            new AlertResultHandler(stateManager, dispatcher),
            EngineConfig.builder().evaluationTimeout(Duration.ofSeconds(5)).build(),
            Clock.systemUTC());
    alertingService = new AlertingService(engine, stateManager, dispatcher);
  }

  @AfterEach
  void tearDown() throws IOException {
    engine.close();
    multiOrgAlertmanager.stop();
    mockWebServer.shutdown();
  }

  @Test
  void testProcessWithoutAlertmanagerHasNoSideEffects() {
    AlertProcessRequest request =
        AlertProcessRequest.builder()
            .alertRule(rule().toBuilder().orgId(2L).build())
            .evaluationResults(List.of(alerting()))
            .build();

    ApiResponse response = alertingService.routeProcessAlert(request);

    Assertions.assertEquals(400, response.getStatus());
    Assertions.assertEquals(
        Map.of("message", AlertingService.NO_ALERTMANAGER_MESSAGE), response.getBody());
    verifyNoInteractions(instanceStore);
    Assertions.assertTrue(stateManager.getAll().isEmpty());
    Assertions.assertEquals(0, mockWebServer.getRequestCount());
  }

  @Test
  void testProcessFoldsStateAndSendsAlerts() throws Exception {
    mockWebServer.enqueue(new MockResponse().setResponseCode(200));

    ApiResponse response =
        alertingService.routeProcessAlert(
            AlertProcessRequest.builder()
                .alertRule(rule())
                .evaluationResults(List.of(alerting()))
                .build());

    Assertions.assertEquals(200, response.getStatus());
    PostableAlerts alerts = (PostableAlerts) response.getBody();
    Assertions.assertEquals(1, alerts.size());
    Assertions.assertEquals(
        "High CPU", alerts.getPostableAlerts().get(0).getLabels().get("alertname"));
    RecordedRequest recordedRequest = mockWebServer.takeRequest();
    Assertions.assertEquals("/api/v2/alerts", recordedRequest.getPath());

    List<AlertState> states = stateManager.getStatesForRule(1L, "rule-1");
    Assertions.assertEquals(1, states.size());
    Assertions.assertEquals(EvalState.Alerting, states.get(0).getState());
    verify(instanceStore).saveAlertInstance(any());
  }

  @Test
  void testProcessAcceptsNullMaps() {
    mockWebServer.enqueue(new MockResponse().setResponseCode(200));
    AlertingApi alertingApi = new AlertingApi(alertingService);

    ApiResponse response =
        alertingApi.process(
            processBody(
                "{\"instance\":null,\"state\":1,\"evaluatedAt\":\"2022-10-01T10:00:00Z\","
                    + "\"values\":null,\"error\":{\"type\":\"OTHER\",\"metadata\":null}}"));

    Assertions.assertEquals(200, response.getStatus());
    List<AlertState> states = stateManager.getStatesForRule(1L, "rule-1");
    Assertions.assertEquals(1, states.size());
    Assertions.assertEquals(EvalState.Alerting, states.get(0).getState());
    Assertions.assertTrue(states.get(0).getValues().isEmpty());
  }

  @Test
  void testProcessWithoutEvaluationTimeIsRejected() {
    AlertingApi alertingApi = new AlertingApi(alertingService);

    ApiResponse response =
        alertingApi.process(processBody("{\"instance\":{\"host\":\"a\"},\"state\":1}"));

    Assertions.assertEquals(400, response.getStatus());
    Assertions.assertEquals(
        Map.of(
            "message", "invalid evaluation results: Missing evaluatedAt of evaluation result"),
        response.getBody());
    Assertions.assertTrue(stateManager.getAll().isEmpty());
    verifyNoInteractions(instanceStore);
    Assertions.assertEquals(0, mockWebServer.getRequestCount());
  }

  @Test
  void testProcessWithoutStateIsRejected() {
    AlertingApi alertingApi = new AlertingApi(alertingService);

    ApiResponse response =
        alertingApi.process(
            processBody(
                "{\"instance\":{\"host\":\"a\"},"
                    + "\"evaluatedAt\":\"2022-10-01T10:00:00Z\"}"));

    Assertions.assertEquals(400, response.getStatus());
    Assertions.assertTrue(stateManager.getAll().isEmpty());
    verifyNoInteractions(instanceStore);
  }

  @Test
  void testProcessReportsDeliveryFailure() {
    mockWebServer.enqueue(new MockResponse().setResponseCode(503).setBody("unavailable"));

    ApiResponse response =
        alertingService.routeProcessAlert(
            AlertProcessRequest.builder()
                .alertRule(rule())
                .evaluationResults(List.of(alerting()))
                .build());

    Assertions.assertEquals(500, response.getStatus());
  }

  @Test
  void testProcessRejectsRuleWithoutUid() {
    ApiResponse response =
        alertingService.routeProcessAlert(
            AlertProcessRequest.builder().alertRule(rule().toBuilder().uid(null).build()).build());

    Assertions.assertEquals(400, response.getStatus());
    verifyNoInteractions(instanceStore);
  }

  @Test
  void testProcessRejectsInvalidState() {
    ApiResponse response =
        alertingService.routeProcessAlert(
            AlertProcessRequest.builder()
                .alertRule(rule())
                .evaluationResults(
                    List.of(ApiEvalResult.builder().state(42).evaluatedAt(T0).build()))
                .build());

    Assertions.assertEquals(400, response.getStatus());
  }

  @Test
  void testEvaluateReturnsResults() throws Exception {
    when(conditionEvaluator.conditionEval(any(), any(), any()))
        .thenReturn(
            List.of(
                EvaluationResult.builder()
                    .instance(Labels.of(Map.of("host", "a")))
                    .state(EvalState.Alerting)
                    .evaluatedAt(T0)
                    .build()));

    ApiResponse response =
        alertingService.routeEvaluateAlert(
            AlertEvaluationRequest.builder().alertRule(rule()).evalTime(T0).build());

    Assertions.assertEquals(200, response.getStatus());
    @SuppressWarnings("unchecked")
    List<ApiEvalResult> results = (List<ApiEvalResult>) response.getBody();
    Assertions.assertEquals(1, results.size());
    Assertions.assertEquals(
        Integer.valueOf(EvalState.Alerting.ordinal()), results.get(0).getState());
    Assertions.assertEquals(Map.of("host", "a"), results.get(0).getInstance());
    // evaluation alone never touches alert state
    verifyNoInteractions(instanceStore);
  }

  @Test
  void testEvaluateReportsQueryErrorInResult() throws Exception {
    when(conditionEvaluator.conditionEval(any(), any(), any()))
        .thenThrow(new QueryException("A", new IOException("connection refused")));

    ApiResponse response =
        alertingService.routeEvaluateAlert(
            AlertEvaluationRequest.builder().alertRule(rule()).evalTime(T0).build());

    Assertions.assertEquals(200, response.getStatus());
    @SuppressWarnings("unchecked")
    List<ApiEvalResult> results = (List<ApiEvalResult>) response.getBody();
    ApiEvalError error = results.get(0).getError();
    Assertions.assertEquals(EvalState.Error.name(), results.get(0).getStateName());
    Assertions.assertEquals(ApiErrorType.QUERY_ERROR, error.getType());
    Assertions.assertEquals("connection refused", error.getMessage());
    Assertions.assertEquals("A", error.getMetadata().get(ApiEvalError.REF_ID_METADATA));
  }

  @Test
  void testEvaluateRejectsInvalidRule() {
    ApiResponse response =
        alertingService.routeEvaluateAlert(
            AlertEvaluationRequest.builder()
                .alertRule(rule().toBuilder().condition("Z").build())
                .build());

    Assertions.assertEquals(400, response.getStatus());
    verifyNoInteractions(conditionEvaluator);
  }

  static AlertRule rule() {
    return AlertRule.builder()
        .orgId(1L)
        .uid("rule-1")
        .title("High CPU")
        .intervalSeconds(10)
        .condition("A")
        .data(List.of(AlertQuery.builder().refId("A").datasourceUid("prometheus").build()))
        .build();
  }

  private static String processBody(String evaluationResult) {
    return "{\"alertRule\":{\"orgId\":1,\"uid\":\"rule-1\",\"title\":\"High CPU\","
        + "\"intervalSeconds\":10,\"condition\":\"A\"},\"evaluationResults\":["
        + evaluationResult
        + "]}";
  }

  private static ApiEvalResult alerting() {
    return ApiEvalResult.builder()
        .instance(Map.of("host", "a"))
        .state(EvalState.Alerting.ordinal())
        .evaluatedAt(T0)
        .build();
  }
}

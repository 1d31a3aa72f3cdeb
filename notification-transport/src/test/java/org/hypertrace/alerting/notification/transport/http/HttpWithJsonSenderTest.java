package org.hypertrace.alerting.notification.transport.http;

import java.io.IOException;
import java.util.Map;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HttpWithJsonSenderTest {
  private MockWebServer mockWebServer;
  private HttpWithJsonSender sender;

  @BeforeEach
  void setUp() throws IOException {
    mockWebServer = new MockWebServer();
    mockWebServer.start();
    sender = new HttpWithJsonSender(new OkHttpClient());
  }

  @AfterEach
  void tearDown() throws IOException {
    mockWebServer.shutdown();
  }

  @Test
  void testPostsJsonWithHeaders() throws Exception {
    mockWebServer.enqueue(new MockResponse().setResponseCode(202).setBody("accepted"));

    HttpWithJsonSender.HttpResult result =
        sender.send(
            mockWebServer.url("/hook").toString(), Map.of("X-Scope-OrgID", "7"), "[{\"a\":1}]");

    Assertions.assertTrue(result.isSuccessful());
    Assertions.assertEquals("accepted", result.getBody());
    RecordedRequest request = mockWebServer.takeRequest();
    Assertions.assertEquals("POST", request.getMethod());
    Assertions.assertEquals("7", request.getHeader("X-Scope-OrgID"));
    Assertions.assertEquals("application/json; charset=utf-8", request.getHeader("Content-Type"));
    Assertions.assertEquals("[{\"a\":1}]", request.getBody().readUtf8());
  }

  @Test
  void testNonSuccessIsReturnedNotThrown() throws Exception {
    mockWebServer.enqueue(new MockResponse().setResponseCode(400).setBody("bad alerts"));

    HttpWithJsonSender.HttpResult result =
        sender.send(mockWebServer.url("/").toString(), Map.of(), "[]");

    Assertions.assertFalse(result.isSuccessful());
    Assertions.assertEquals(400, result.getCode());
  }
}

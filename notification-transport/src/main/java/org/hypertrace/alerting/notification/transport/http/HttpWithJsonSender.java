package org.hypertrace.alerting.notification.transport.http;

import com.google.common.annotations.VisibleForTesting;
import java.io.IOException;
import java.util.Map;
import lombok.Value;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Generic sender posting a JSON string to a URL. Stateless apart from the shared client; callers
 * decide what a response code means.
 */
public class HttpWithJsonSender {
  private static final Logger LOGGER = LoggerFactory.getLogger(HttpWithJsonSender.class);
  public static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
  private static final HttpWithJsonSender INSTANCE = new HttpWithJsonSender(new OkHttpClient());

  private final OkHttpClient client;

  @VisibleForTesting
  public HttpWithJsonSender(OkHttpClient client) {
    this.client = client;
  }

  public static HttpWithJsonSender getInstance() {
    return INSTANCE;
  }

  public HttpResult send(String url, Map<String, String> headers, String jsonString)
      throws IOException {
    LOGGER.debug("Sending the following json string to {}: {}", url, jsonString);
    Request.Builder requestBuilder =
        new Request.Builder().url(url).post(RequestBody.create(jsonString, JSON));
    headers.forEach(requestBuilder::header);
    try (Response response = client.newCall(requestBuilder.build()).execute()) {
      ResponseBody body = response.body();
      return new HttpResult(response.code(), body == null ? "" : body.string());
    } catch (IOException ioe) {
      LOGGER.error("Unable to send json string to URL: {}", url, ioe);
      throw ioe;
    }
  }

  @Value
  public static class HttpResult {
    int code;
    String body;

    public boolean isSuccessful() {
      return code >= 200 && code < 300;
    }
  }
}

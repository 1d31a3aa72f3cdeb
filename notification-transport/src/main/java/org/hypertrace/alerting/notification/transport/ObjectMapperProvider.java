package org.hypertrace.alerting.notification.transport;

import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/** Mapper for outgoing notification payloads: nulls dropped, instants as ISO-8601 strings. */
public class ObjectMapperProvider {
  private static volatile ObjectMapper objectMapper;

  public static ObjectMapper get() {
    if (objectMapper == null) {
      synchronized (ObjectMapperProvider.class) {
        if (objectMapper == null) {
          objectMapper =
              new ObjectMapper()
                  .registerModule(new JavaTimeModule())
                  .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                  .setSerializationInclusion(Include.NON_NULL);
        }
      }
    }
    return objectMapper;
  }
}

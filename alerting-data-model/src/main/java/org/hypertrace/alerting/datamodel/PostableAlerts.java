package org.hypertrace.alerting.datamodel;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.util.List;
import lombok.Value;

@Value
public class PostableAlerts {
  List<PostableAlert> postableAlerts;

  public static PostableAlerts empty() {
    return new PostableAlerts(List.of());
  }

  @JsonIgnore
  public boolean isEmpty() {
    return postableAlerts.isEmpty();
  }

  public int size() {
    return postableAlerts.size();
  }
}

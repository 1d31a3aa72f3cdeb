package org.hypertrace.alerting.datamodel;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** What an alert instance becomes when its rule evaluation fails. */
public enum ExecutionErrorState {
  ALERTING("Alerting"),
  ERROR("Error"),
  OK("OK"),
  KEEP_LAST_STATE("KeepLastState");

  private final String value;

  ExecutionErrorState(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  @JsonCreator
  public static ExecutionErrorState fromValue(String value) {
    for (ExecutionErrorState state : values()) {
      if (state.value.equalsIgnoreCase(value)) {
        return state;
      }
    }
    throw new IllegalArgumentException(String.format("Unknown execution error state:%s", value));
  }
}

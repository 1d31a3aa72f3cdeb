package org.hypertrace.alerting.datamodel;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** What an alert instance becomes when its rule evaluation returns no data. */
public enum NoDataState {
  ALERTING("Alerting"),
  NO_DATA("NoData"),
  OK("OK"),
  KEEP_LAST_STATE("KeepLastState");

  private final String value;

  NoDataState(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  @JsonCreator
  public static NoDataState fromValue(String value) {
    for (NoDataState state : values()) {
      if (state.value.equalsIgnoreCase(value)) {
        return state;
      }
    }
    throw new IllegalArgumentException(String.format("Unknown no data state:%s", value));
  }
}

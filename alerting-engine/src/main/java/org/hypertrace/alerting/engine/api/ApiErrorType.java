package org.hypertrace.alerting.engine.api;

public enum ApiErrorType {
  QUERY_ERROR,
  OTHER
}

package org.hypertrace.alerting.evaluator;

/** Failure attributable to a single query of the condition, identified by its ref id. */
public class QueryException extends EvaluationException {
  private final String refId;

  public QueryException(String refId, Throwable cause) {
    super(
        String.format("failed to execute query %s: %s", refId, cause.getMessage()), cause);
    this.refId = refId;
  }

  public String getRefId() {
    return refId;
  }

  /** Message of the underlying query failure, without the ref id prefix. */
  public String getQueryErrorMessage() {
    return getCause().getMessage();
  }
}

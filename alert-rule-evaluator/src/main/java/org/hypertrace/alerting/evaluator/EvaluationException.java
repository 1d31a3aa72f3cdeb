package org.hypertrace.alerting.evaluator;

/** Generic failure of a condition evaluation. */
public class EvaluationException extends Exception {

  public EvaluationException(String message) {
    super(message);
  }

  public EvaluationException(String message, Throwable cause) {
    super(message, cause);
  }
}

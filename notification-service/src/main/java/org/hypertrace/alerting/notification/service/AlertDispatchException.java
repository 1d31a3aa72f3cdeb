package org.hypertrace.alerting.notification.service;

/** Base of failures handing alerts over to an alertmanager. */
public class AlertDispatchException extends Exception {
  public AlertDispatchException(String message) {
    super(message);
  }

  public AlertDispatchException(String message, Throwable cause) {
    super(message, cause);
  }
}

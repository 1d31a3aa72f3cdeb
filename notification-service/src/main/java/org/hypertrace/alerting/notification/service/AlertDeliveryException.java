package org.hypertrace.alerting.notification.service;

public class AlertDeliveryException extends AlertDispatchException {
  public AlertDeliveryException(String message, Throwable cause) {
    super(message, cause);
  }
}

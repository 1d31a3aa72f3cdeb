package org.hypertrace.alerting.notification.transport;

/** Payload could not be delivered; {@link #getStatusCode()} is -1 when no response was received. */
public class NotificationTransportException extends Exception {
  private final int statusCode;

  public NotificationTransportException(String message, int statusCode) {
    super(message);
    this.statusCode = statusCode;
  }

  public NotificationTransportException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = -1;
  }

  public int getStatusCode() {
    return statusCode;
  }
}

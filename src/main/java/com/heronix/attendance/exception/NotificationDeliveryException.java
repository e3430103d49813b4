package com.heronix.attendance.exception;

/**
 * Exception thrown when a notifier transport cannot deliver an alert.
 */
public class NotificationDeliveryException extends RuntimeException {

    public NotificationDeliveryException(String message) {
        super(message);
    }

    public NotificationDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}

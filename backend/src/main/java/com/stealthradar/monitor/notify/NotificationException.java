package com.stealthradar.monitor.notify;

/**
 * Notification API call failed (transport error or non-2xx response).
 */
public class NotificationException extends RuntimeException {

    public NotificationException(String message, Throwable cause) {
        super(message, cause);
    }
}

package com.stealthradar.monitor.notify;

/**
 * Outbound notification API. One call per notification, no internal retry.
 */
public interface NotificationClient {

    /**
     * @throws NotificationException if the notification was not accepted
     */
    void send(NotificationMessage message);
}

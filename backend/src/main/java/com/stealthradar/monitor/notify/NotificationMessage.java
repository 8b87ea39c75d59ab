package com.stealthradar.monitor.notify;

import java.util.Map;

/**
 * Body of one call to the notification API.
 */
public record NotificationMessage(
        String userId,
        String type,
        String title,
        String body,
        Map<String, Object> data,
        String targetUrl
) {
}

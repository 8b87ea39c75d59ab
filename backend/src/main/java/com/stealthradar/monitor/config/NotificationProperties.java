package com.stealthradar.monitor.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Notification API endpoint and per-user throttling.
 */
@ConfigurationProperties(prefix = "stealthradar.notification")
@NoArgsConstructor
@Getter
@Setter
public class NotificationProperties {

    /** Base URL of the notification service; requests go to {@code <baseUrl>/api/notify}. */
    private String baseUrl = "http://localhost:3000";

    /** Bearer token for the notification service. */
    private String secret = "";

    /** Link opened from the notification. */
    private String targetUrl = "http://localhost:3000?tab=privacy";

    private Duration requestTimeout = Duration.ofSeconds(10);

    /** Cooldown between two notifications to the same user. */
    private Duration minNotificationInterval = Duration.ofMinutes(5);

    private int maxNotificationsPerHour = 10;
}

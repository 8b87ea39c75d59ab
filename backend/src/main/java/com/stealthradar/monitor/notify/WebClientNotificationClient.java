package com.stealthradar.monitor.notify;

import com.stealthradar.monitor.config.NotificationProperties;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

/**
 * Notification API client using WebClient: POST {@code <baseUrl>/api/notify} with a bearer secret.
 */
public class WebClientNotificationClient implements NotificationClient {

    static final String NOTIFY_PATH = "/api/notify";

    private final WebClient webClient;
    private final String secret;
    private final Duration requestTimeout;

    public WebClientNotificationClient(WebClient.Builder builder, NotificationProperties properties) {
        this.webClient = builder.baseUrl(properties.getBaseUrl()).build();
        this.secret = properties.getSecret();
        this.requestTimeout = properties.getRequestTimeout();
    }

    @Override
    public void send(NotificationMessage message) {
        try {
            webClient.post()
                    .uri(NOTIFY_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(h -> {
                        if (secret != null && !secret.isBlank()) {
                            h.setBearerAuth(secret);
                        }
                    })
                    .bodyValue(message)
                    .retrieve()
                    .toBodilessEntity()
                    .block(requestTimeout);
        } catch (RuntimeException e) {
            throw new NotificationException("Notification to " + message.userId() + " failed: " + e.getMessage(), e);
        }
    }
}

package com.stealthradar.monitor.notify;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.stealthradar.domain.MonitoredUser;
import com.stealthradar.domain.StealthEvent;
import com.stealthradar.monitor.config.NotificationProperties;
import com.stealthradar.monitor.user.UserStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Decides, per (event, user), whether to notify and performs the notification.
 *
 * <p>Order: preference, relevance, cooldown, hourly budget, send. Throttle state (bucket, lastNotifiedAt) only
 * moves after a successful send, so a failed send leaves the next relevant event a genuine retry.
 *
 * <p>Cooldown state and the send lock are keyed by userId, so they hold across user registry refreshes that
 * replace the {@link MonitoredUser} instances.
 */
@Slf4j
@Component
public class NotificationDispatcher {

    private static final Duration USER_STATE_RETENTION = Duration.ofHours(1);

    static final String NOTIFICATION_TYPE = "stealth";

    private final NotificationClient notificationClient;
    private final StealthAddressMatcher stealthAddressMatcher;
    private final NotificationRateLimiter rateLimiter;
    private final UserStore userStore;
    private final NotificationProperties properties;
    private final Clock clock;
    private final Cache<String, Instant> lastSentByUser;
    private final Cache<String, Object> userLocks;

    public NotificationDispatcher(
            NotificationClient notificationClient,
            StealthAddressMatcher stealthAddressMatcher,
            NotificationRateLimiter rateLimiter,
            UserStore userStore,
            NotificationProperties properties,
            Clock clock
    ) {
        this.notificationClient = notificationClient;
        this.stealthAddressMatcher = stealthAddressMatcher;
        this.rateLimiter = rateLimiter;
        this.userStore = userStore;
        this.properties = properties;
        this.clock = clock;
        Duration retention = properties.getMinNotificationInterval().compareTo(USER_STATE_RETENTION) > 0
                ? properties.getMinNotificationInterval()
                : USER_STATE_RETENTION;
        this.lastSentByUser = Caffeine.newBuilder().expireAfterWrite(retention).maximumSize(100_000).build();
        this.userLocks = Caffeine.newBuilder().expireAfterAccess(retention).maximumSize(100_000).build();
    }

    enum Relevance {
        SENDER,
        RECIPIENT,
        REGISTRANT,
        NONE
    }

    /**
     * Evaluates every user for one event. A failure for one user never affects the others.
     *
     * @return number of users notified
     */
    public int dispatch(StealthEvent event, List<MonitoredUser> users) {
        int notified = 0;
        for (MonitoredUser user : users) {
            try {
                if (maybeNotify(event, user).isNotified()) {
                    notified++;
                }
            } catch (RuntimeException e) {
                log.error("Error checking notification for user {} on {}: {}", user.getUserId(), event.identity(), e.getMessage(), e);
            }
        }
        return notified;
    }

    public DispatchOutcome maybeNotify(StealthEvent event, MonitoredUser user) {
        if (!user.getNotificationPrefs().allows(event.kind())) {
            return DispatchOutcome.PREFERENCE_DISABLED;
        }
        Relevance relevance = relevanceOf(event, user);
        if (relevance == Relevance.NONE) {
            return DispatchOutcome.NOT_RELEVANT;
        }
        String userId = user.getUserId();
        synchronized (userLocks.get(userId, id -> new Object())) {
            Instant now = clock.instant();
            if (Duration.between(lastNotifiedAt(user), now).compareTo(properties.getMinNotificationInterval()) < 0) {
                log.debug("Skipping {} for {}: cooldown", event.identity(), user.getUserId());
                return DispatchOutcome.COOLDOWN;
            }
            if (!rateLimiter.allows(user.getUserId(), now)) {
                log.debug("Skipping {} for {}: hourly limit reached", event.identity(), user.getUserId());
                return DispatchOutcome.RATE_LIMITED;
            }
            NotificationMessage message = compose(event, user, relevance);
            try {
                notificationClient.send(message);
            } catch (RuntimeException e) {
                log.warn("Failed to send stealth notification to {}: {}", user.getUserId(), e.getMessage());
                return DispatchOutcome.SEND_FAILED;
            }
            rateLimiter.record(userId, now);
            lastSentByUser.put(userId, now);
            user.markNotified(now);
            persistLastNotified(user.getUserId(), now);
            log.info("Sent stealth notification to {}: {} ({} on {})", user.getUserId(), message.title(), event.txHash(), event.chain());
            return DispatchOutcome.NOTIFIED;
        }
    }

    private Instant lastNotifiedAt(MonitoredUser user) {
        Instant known = user.getLastNotifiedAt();
        Instant sent = lastSentByUser.getIfPresent(user.getUserId());
        return sent != null && sent.isAfter(known) ? sent : known;
    }

    Relevance relevanceOf(StealthEvent event, MonitoredUser user) {
        if (event instanceof StealthEvent.Announcement announcement) {
            if (user.hasAddress(announcement.caller())) {
                return Relevance.SENDER;
            }
            if (!user.getScanKeys().isEmpty()
                    && announcement.stealthAddress() != null
                    && stealthAddressMatcher.matches(announcement, user.getScanKeys())) {
                return Relevance.RECIPIENT;
            }
            return Relevance.NONE;
        }
        if (event instanceof StealthEvent.Registration registration && user.hasAddress(registration.registrant())) {
            return Relevance.REGISTRANT;
        }
        return Relevance.NONE;
    }

    private NotificationMessage compose(StealthEvent event, MonitoredUser user, Relevance relevance) {
        String title;
        String body;
        switch (relevance) {
            case SENDER -> {
                title = "Stealth Payment Sent";
                body = "Your stealth payment has been announced onchain";
            }
            case RECIPIENT -> {
                title = "Stealth Payment Received";
                body = "You received a stealth payment. Check your stealth addresses.";
            }
            default -> {
                title = "Stealth Address Registered";
                body = "A stealth meta-address has been registered";
            }
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("eventType", event.kind().name().toLowerCase(Locale.ROOT));
        data.put("txHash", event.txHash());
        data.put("blockNumber", event.blockNumber());
        data.put("chain", event.chain());
        data.put("chainId", event.chainId());
        if (event instanceof StealthEvent.Announcement announcement) {
            data.put("stealthAddress", announcement.stealthAddress());
        }
        data.put("timestamp", event.timestampApprox().getEpochSecond());
        return new NotificationMessage(user.getUserId(), NOTIFICATION_TYPE, title, body, data, properties.getTargetUrl());
    }

    private void persistLastNotified(String userId, Instant at) {
        try {
            userStore.updateLastNotified(userId, at);
        } catch (RuntimeException e) {
            log.warn("Failed to update last notified for {}: {}", userId, e.getMessage());
        }
    }
}

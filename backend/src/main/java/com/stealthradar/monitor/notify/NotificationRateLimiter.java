package com.stealthradar.monitor.notify;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.stealthradar.monitor.config.NotificationProperties;
import com.stealthradar.monitor.state.StateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Per-user hourly notification budget. The hour-aligned bucket lives in the external state store (TTL one hour);
 * an in-process sliding window of send times enforces the same budget over any rolling hour and keeps
 * working when the store is unreachable.
 */
@Slf4j
@Component
public class NotificationRateLimiter {

    static final Duration BUCKET_WIDTH = Duration.ofHours(1);

    private final StateStore stateStore;
    private final NotificationProperties properties;
    private final Cache<String, Deque<Instant>> recentSends = Caffeine.newBuilder()
            .expireAfterWrite(BUCKET_WIDTH)
            .maximumSize(100_000)
            .build();

    public NotificationRateLimiter(StateStore stateStore, NotificationProperties properties) {
        this.stateStore = stateStore;
        this.properties = properties;
    }

    public boolean allows(String userId, Instant now) {
        int max = properties.getMaxNotificationsPerHour();
        if (sendsInLastHour(userId, now) >= max) {
            return false;
        }
        long bucketCount;
        try {
            bucketCount = stateStore.getCounter(bucketKey(userId, now));
        } catch (RuntimeException e) {
            log.debug("Notification bucket unavailable for {}: {}", userId, e.getMessage());
            bucketCount = 0;
        }
        return bucketCount < max;
    }

    /**
     * Counts one successful send.
     */
    public void record(String userId, Instant now) {
        recentSends.asMap().compute(userId, (id, sends) -> {
            Deque<Instant> window = sends != null ? sends : new ArrayDeque<>();
            synchronized (window) {
                window.addLast(now);
            }
            return window;
        });
        try {
            stateStore.increment(bucketKey(userId, now), BUCKET_WIDTH);
        } catch (RuntimeException e) {
            log.warn("Failed to track notification for {}: {}", userId, e.getMessage());
        }
    }

    int sendsInLastHour(String userId, Instant now) {
        Deque<Instant> window = recentSends.getIfPresent(userId);
        if (window == null) {
            return 0;
        }
        synchronized (window) {
            Instant cutoff = now.minus(BUCKET_WIDTH);
            while (!window.isEmpty() && !window.peekFirst().isAfter(cutoff)) {
                window.pollFirst();
            }
            return window.size();
        }
    }

    static String bucketKey(String userId, Instant now) {
        return "stealth-notifications:" + userId + ":" + now.getEpochSecond() / BUCKET_WIDTH.toSeconds();
    }
}

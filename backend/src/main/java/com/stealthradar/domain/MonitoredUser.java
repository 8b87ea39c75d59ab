package com.stealthradar.domain;

import lombok.Getter;

import java.time.Instant;
import java.util.List;

/**
 * User opted into stealth notifications, as loaded by the user registry. Everything but
 * {@code lastNotifiedAt} is fixed for the lifetime of one registry snapshot.
 */
@Getter
public class MonitoredUser {

    private final String userId;
    private final String address;
    private final NotificationPrefs notificationPrefs;
    private final List<String> scanKeys;
    private volatile Instant lastNotifiedAt;

    public MonitoredUser(String userId, String address, NotificationPrefs notificationPrefs,
                         Instant lastNotifiedAt, List<String> scanKeys) {
        this.userId = userId;
        this.address = address;
        this.notificationPrefs = notificationPrefs != null ? notificationPrefs : NotificationPrefs.all();
        this.lastNotifiedAt = lastNotifiedAt != null ? lastNotifiedAt : Instant.EPOCH;
        this.scanKeys = scanKeys != null ? List.copyOf(scanKeys) : List.of();
    }

    /**
     * Moves {@code lastNotifiedAt} forward; an older timestamp is ignored.
     */
    public synchronized void markNotified(Instant at) {
        if (at != null && at.isAfter(lastNotifiedAt)) {
            lastNotifiedAt = at;
        }
    }

    public boolean hasAddress(String other) {
        return address != null && other != null && address.equalsIgnoreCase(other);
    }
}

package com.stealthradar.monitor.user;

import com.stealthradar.domain.MonitoredUser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time snapshot of users who want stealth notifications. Each refresh replaces the whole snapshot;
 * a failed refresh keeps the previous one.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class UserRegistry {

    private final UserStore userStore;

    private volatile Map<String, MonitoredUser> snapshot = Map.of();

    /**
     * @return true if the snapshot was replaced
     */
    public boolean refresh() {
        List<MonitoredUser> loaded;
        try {
            loaded = userStore.listUsersWithStealthNotificationsEnabled();
        } catch (RuntimeException e) {
            log.warn("User refresh failed, keeping previous snapshot of {} users: {}", snapshot.size(), e.getMessage());
            return false;
        }
        if (loaded == null) {
            log.warn("User store returned no snapshot, keeping previous snapshot of {} users", snapshot.size());
            return false;
        }
        Map<String, MonitoredUser> previous = snapshot;
        Map<String, MonitoredUser> next = new LinkedHashMap<>();
        for (MonitoredUser user : loaded) {
            MonitoredUser known = previous.get(user.getUserId());
            if (known != null) {
                // a failed lastNotified write must not reopen the cooldown
                user.markNotified(known.getLastNotifiedAt());
            }
            next.put(user.getUserId(), user);
        }
        snapshot = Collections.unmodifiableMap(next);
        log.info("Monitoring {} users for stealth events", next.size());
        return true;
    }

    /**
     * Read-only snapshot for iteration.
     */
    public List<MonitoredUser> all() {
        return List.copyOf(snapshot.values());
    }

    public int size() {
        return snapshot.size();
    }
}

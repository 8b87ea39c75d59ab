package com.stealthradar.monitor.user;

import com.stealthradar.domain.MonitoredUser;
import com.stealthradar.domain.NotificationPrefs;
import com.stealthradar.domain.StealthUser;
import com.stealthradar.domain.StealthUserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link UserStore} over the stealth_users collection.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MongoUserStore implements UserStore {

    private final StealthUserRepository repository;

    @Override
    public List<MonitoredUser> listUsersWithStealthNotificationsEnabled() {
        List<MonitoredUser> users = new ArrayList<>();
        for (StealthUser doc : repository.findWithStealthNotificationsEnabled()) {
            if (doc.getUserId() == null || doc.getAddress() == null) {
                log.debug("Skipping stealth user document {} without userId/address", doc.getId());
                continue;
            }
            users.add(toMonitoredUser(doc));
        }
        return users;
    }

    @Override
    public void updateLastNotified(String userId, Instant at) {
        if (!repository.updateLastStealthNotification(userId, at)) {
            log.debug("No stealth user document updated for {}", userId);
        }
    }

    static MonitoredUser toMonitoredUser(StealthUser doc) {
        StealthUser.Prefs prefs = doc.getNotificationPrefs();
        NotificationPrefs notificationPrefs = prefs == null
                ? NotificationPrefs.all()
                : new NotificationPrefs(
                        !Boolean.FALSE.equals(prefs.getStealthAnnouncements()),
                        !Boolean.FALSE.equals(prefs.getStealthRegistrations()));
        return new MonitoredUser(
                doc.getUserId(),
                doc.getAddress(),
                notificationPrefs,
                doc.getLastStealthNotification(),
                doc.getStealthScanKeys());
    }
}

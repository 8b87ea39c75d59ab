package com.stealthradar.monitor.user;

import com.stealthradar.domain.MonitoredUser;

import java.time.Instant;
import java.util.List;

/**
 * External user store. Only full snapshots are read; no change feed.
 */
public interface UserStore {

    List<MonitoredUser> listUsersWithStealthNotificationsEnabled();

    void updateLastNotified(String userId, Instant at);
}

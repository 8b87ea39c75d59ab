package com.stealthradar.monitor.notify;

import com.stealthradar.domain.StealthEvent;

import java.util.List;

/**
 * Decides whether an announced stealth address belongs to the holder of one of the given scan keys.
 */
public interface StealthAddressMatcher {

    boolean matches(StealthEvent.Announcement announcement, List<String> scanKeys);
}

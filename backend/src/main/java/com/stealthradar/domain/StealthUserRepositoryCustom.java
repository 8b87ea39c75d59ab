package com.stealthradar.domain;

import java.time.Instant;

/**
 * Targeted updates that must not overwrite fields owned by other writers.
 */
public interface StealthUserRepositoryCustom {

    /**
     * @return true if a user document was updated
     */
    boolean updateLastStealthNotification(String userId, Instant at);
}

package com.stealthradar.domain;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for stealth_users. Used by the monitor's user store.
 */
public interface StealthUserRepository extends MongoRepository<StealthUser, String>, StealthUserRepositoryCustom {

    Optional<StealthUser> findByUserId(String userId);

    /** Users that did not switch stealth notifications off (missing flag = enabled). */
    @Query("{ 'notificationPrefs.stealthEnabled': { $ne: false } }")
    List<StealthUser> findWithStealthNotificationsEnabled();
}

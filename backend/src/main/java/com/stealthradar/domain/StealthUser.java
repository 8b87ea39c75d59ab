package com.stealthradar.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * User record in the shared user store. Written by the user-facing services; this service only reads it and
 * updates {@code lastStealthNotification}.
 */
@Document(collection = "stealth_users")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class StealthUser {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed(unique = true)
    private String userId;
    private String address;
    private Prefs notificationPrefs;
    private Instant lastStealthNotification;
    private List<String> stealthScanKeys = new ArrayList<>();
    private Instant lastUpdated;

    /**
     * Missing flags count as enabled.
     */
    @NoArgsConstructor
    @Getter
    @Setter
    public static class Prefs {
        private Boolean stealthEnabled;
        private Boolean stealthAnnouncements;
        private Boolean stealthRegistrations;
        private Boolean stealthPayments;
    }
}

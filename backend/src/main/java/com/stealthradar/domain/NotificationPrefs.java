package com.stealthradar.domain;

/**
 * Which stealth event kinds a user wants to hear about.
 */
public record NotificationPrefs(boolean announcements, boolean registrations) {

    public static NotificationPrefs all() {
        return new NotificationPrefs(true, true);
    }

    public boolean allows(StealthEvent.Kind kind) {
        return switch (kind) {
            case ANNOUNCEMENT -> announcements;
            case REGISTRATION -> registrations;
        };
    }
}

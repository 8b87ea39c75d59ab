package com.stealthradar.monitor.notify;

/**
 * Result of evaluating one (event, user) pair.
 */
public enum DispatchOutcome {
    NOTIFIED,
    PREFERENCE_DISABLED,
    NOT_RELEVANT,
    COOLDOWN,
    RATE_LIMITED,
    SEND_FAILED;

    public boolean isNotified() {
        return this == NOTIFIED;
    }
}

package com.kincircle.trust.service.model;

import java.time.Duration;
import java.time.Instant;

/**
 * Failed-attempt counter for one principal. {@code lockoutUntil} is {@code null}
 * until the failure threshold is reached.
 */
public record LockoutState(int failedAttempts, Instant lockoutUntil) {

    public static final LockoutState EMPTY = new LockoutState(0, null);

    public boolean isLockedOut(Instant now) {
        return lockoutUntil != null && now.isBefore(lockoutUntil);
    }

    /** Whole seconds until the window ends, rounded up; 0 when not locked out. */
    public long remainingSeconds(Instant now) {
        if (!isLockedOut(now)) return 0;
        long millis = Duration.between(now, lockoutUntil).toMillis();
        return (millis + 999) / 1000;
    }
}

package com.kincircle.trust.service.model;

/**
 * Settings consumed from the external settings store.
 */
public record SessionSettings(boolean autoLockEnabled, long idleTimeoutMs, boolean onboardingComplete) {

    public static final long DEFAULT_IDLE_TIMEOUT_MS = 60_000L;

    public SessionSettings {
        if (idleTimeoutMs <= 0) idleTimeoutMs = DEFAULT_IDLE_TIMEOUT_MS;
    }

    public SessionSettings withAutoLockEnabled(boolean enabled) {
        return new SessionSettings(enabled, idleTimeoutMs, onboardingComplete);
    }

    public SessionSettings withOnboardingComplete(boolean complete) {
        return new SessionSettings(autoLockEnabled, idleTimeoutMs, complete);
    }
}

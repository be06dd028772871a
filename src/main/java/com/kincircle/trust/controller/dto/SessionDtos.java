package com.kincircle.trust.controller.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.kincircle.trust.service.model.ActivitySignal;
import com.kincircle.trust.service.model.SessionState;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

public final class SessionDtos {
    private SessionDtos() {}

    // -------- Requests ----------
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class UnlockRequest {
        @NotBlank
        public String pin;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ActivityRequest {
        public ActivitySignal signal = ActivitySignal.POINTER;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SettingsRequest {
        public boolean autoLockEnabled;
        @Positive
        public long idleTimeoutMs = 60_000;
        public boolean hasCompletedOnboarding;
    }

    // -------- Responses ----------
    public static class SessionView {
        public SessionState state;
        public boolean autoLockEnabled;
        public long idleTimeoutMs;
        public boolean hasCompletedOnboarding;
        public boolean timerArmed;
        public int failedAttempts;
        public long lockedOutSeconds;   // 0 when not locked out
    }
}

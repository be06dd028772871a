package com.kincircle.trust.service.model;

public enum AuditEventType {
    AUTH_SUCCESS,
    AUTH_FAILURE,
    SESSION_TIMEOUT,
    EMERGENCY_ACCESS,
    DATA_RESET,
    SYSTEM_INIT,
    SETTINGS_CHANGE
}

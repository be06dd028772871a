package com.kincircle.trust.service.model;

import java.time.Instant;

/**
 * Security event handed to the external append-only log. Never persisted here.
 */
public record AuditEvent(Instant timestamp, AuditEventType type, Severity severity,
                         String detail, String principalId) {

    public static AuditEvent of(Instant timestamp, AuditEventType type, Severity severity,
                                String detail, String principalId) {
        return new AuditEvent(timestamp, type, severity, detail, principalId);
    }
}

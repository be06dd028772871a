package com.kincircle.trust.service;

import com.kincircle.trust.service.model.AuditEvent;

/**
 * Append-only security log owned by an external collaborator.
 * Implementations must not throw; delivery problems are theirs to report.
 */
public interface AuditTrail {
    void record(AuditEvent event);
}

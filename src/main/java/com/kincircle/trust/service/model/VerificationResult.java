package com.kincircle.trust.service.model;

/**
 * Outcome of checking a PIN against the stored credential.
 *
 * @param migrated {@code true} when a legacy record was re-hashed into the salted format
 */
public record VerificationResult(boolean matched, boolean migrated) {

    public static final VerificationResult MISMATCH = new VerificationResult(false, false);
}

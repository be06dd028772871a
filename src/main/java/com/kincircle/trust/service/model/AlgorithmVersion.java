package com.kincircle.trust.service.model;

import java.util.Arrays;

/**
 * Derivation scheme a stored credential was produced with.
 * Only {@link #SALTED_PBKDF2} is considered secure; the others are kept so that
 * existing records can still be verified and then migrated.
 */
public enum AlgorithmVersion {
    /** 32-bit string hash rendered in base 36, no salt. */
    LEGACY_STRING_HASH(0),
    /** PBKDF2 with the fixed application salt, bare hex without separator. */
    LEGACY_STATIC_SALT(1),
    /** PBKDF2-HMAC-SHA256 with a random per-credential salt, "salt$hash". */
    SALTED_PBKDF2(2);

    private final int code;

    AlgorithmVersion(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public boolean isSecure() {
        return this == SALTED_PBKDF2;
    }

    public static AlgorithmVersion fromCode(int code) {
        return Arrays.stream(values())
                .filter(v -> v.code == code)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown algorithm version: " + code));
    }
}

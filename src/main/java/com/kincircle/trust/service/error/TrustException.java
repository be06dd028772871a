package com.kincircle.trust.service.error;

/**
 * Base of every failure raised by the trust core. Each subtype carries a stable
 * code that is safe to return to clients.
 */
public abstract class TrustException extends RuntimeException {

    private final String code;

    protected TrustException(String code, String message) {
        super(message);
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /** Whether the same call may succeed later without changing the input. */
    public abstract boolean isRetriable();
}

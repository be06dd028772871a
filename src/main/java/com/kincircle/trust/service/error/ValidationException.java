package com.kincircle.trust.service.error;

/** Malformed credential input, rejected before any hashing happens. */
public class ValidationException extends TrustException {

    public ValidationException(String message) {
        super("VALIDATION_ERROR", message);
    }

    @Override
    public boolean isRetriable() {
        return false;
    }
}

package com.kincircle.trust.service.error;

public class AuthenticationFailureException extends TrustException {

    private final int failedAttempts;

    public AuthenticationFailureException(int failedAttempts) {
        super("AUTHENTICATION_FAILURE", "Invalid PIN");
        this.failedAttempts = failedAttempts;
    }

    public int getFailedAttempts() {
        return failedAttempts;
    }

    @Override
    public boolean isRetriable() {
        return true;
    }
}

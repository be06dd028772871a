package com.kincircle.trust.service.error;

public class RateLimitedException extends TrustException {

    private final String budgetKey;
    private final long resetInMs;

    public RateLimitedException(String budgetKey, long resetInMs) {
        super("RATE_LIMITED", "Rate limit exceeded. Try again in " + ((resetInMs + 999) / 1000) + " seconds.");
        this.budgetKey = budgetKey;
        this.resetInMs = resetInMs;
    }

    public String getBudgetKey() {
        return budgetKey;
    }

    public long getResetInMs() {
        return resetInMs;
    }

    @Override
    public boolean isRetriable() {
        return true;
    }
}

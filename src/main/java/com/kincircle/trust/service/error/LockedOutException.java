package com.kincircle.trust.service.error;

/** Too many recent failures; retry only after {@link #getRemainingSeconds()}. */
public class LockedOutException extends TrustException {

    private final long remainingSeconds;

    public LockedOutException(long remainingSeconds) {
        super("LOCKED_OUT", "Too many failed attempts. Try again in " + remainingSeconds + " seconds.");
        this.remainingSeconds = remainingSeconds;
    }

    public long getRemainingSeconds() {
        return remainingSeconds;
    }

    @Override
    public boolean isRetriable() {
        return true;
    }
}

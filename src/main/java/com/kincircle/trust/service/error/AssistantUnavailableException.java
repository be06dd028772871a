package com.kincircle.trust.service.error;

/** The remote model proxy is unset, unreachable or returned nothing usable. */
public class AssistantUnavailableException extends TrustException {

    public AssistantUnavailableException(String message) {
        super("ASSISTANT_UNAVAILABLE", message);
    }

    public AssistantUnavailableException(String message, Throwable cause) {
        this(message);
        initCause(cause);
    }

    @Override
    public boolean isRetriable() {
        return true;
    }
}

package com.kincircle.trust.service.model;

/** Request allowance of one named budget: {@code maxRequests} per fixed window. */
public record RateLimitBudget(int maxRequests, long windowMs) {

    public RateLimitBudget {
        if (maxRequests < 1) throw new IllegalArgumentException("maxRequests must be >= 1");
        if (windowMs < 1) throw new IllegalArgumentException("windowMs must be >= 1");
    }
}

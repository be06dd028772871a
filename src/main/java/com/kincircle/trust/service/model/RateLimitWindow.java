package com.kincircle.trust.service.model;

import java.time.Instant;

public record RateLimitWindow(int count, Instant windowStart) {

    public boolean isExpired(Instant now, long windowMs) {
        return now.toEpochMilli() - windowStart.toEpochMilli() >= windowMs;
    }
}

package com.sportsdata.application.ratelimit;

import java.time.Duration;

/**
 * Request budget of one upstream endpoint: at most {@code requests} per {@code period}.
 */
public record RateLimitRule(int requests, Duration period) {

    public RateLimitRule {
        if (requests < 0) {
            throw new IllegalArgumentException("requests must not be negative");
        }
        if (period == null || period.toMillis() < 1) {
            throw new IllegalArgumentException("period must be at least 1ms, got " + period);
        }
    }
}

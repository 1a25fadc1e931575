package com.sportsdata.application.ratelimit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Fixed-window request budget tracker, one budget per upstream endpoint.
 *
 * <p>Time is cut into buckets of {@code period} length ({@code floor(now / period)}) and each
 * bucket counts independently. Up to twice the limit can therefore pass around a bucket
 * boundary. Endpoints without a rule are never limited.
 *
 * <p>Buckets are never removed once created.
 */
public class RateLimiter {

    private static final Logger logger = LoggerFactory.getLogger(RateLimiter.class);

    private final Map<String, RateLimitRule> rules;
    private final Map<String, RateLimitWindow> windows = new HashMap<>();
    private final Clock clock;

    public RateLimiter(Map<String, RateLimitRule> rules, Clock clock) {
        this.rules = Map.copyOf(rules);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Checks whether another request to the endpoint fits into the current window.
     */
    public synchronized boolean canMakeRequest(String endpointId) {
        RateLimitRule rule = rules.get(endpointId);
        if (rule == null) {
            return true;
        }
        RateLimitWindow window = windows.get(windowKey(endpointId, rule));
        boolean allowed = window == null || window.hasCapacity();
        if (!allowed) {
            logger.debug("Rate limit reached for {}: {}/{} in current window",
                endpointId, window.count(), window.limit());
        }
        return allowed;
    }

    /**
     * Counts one request against the current window of the endpoint.
     */
    public synchronized void recordRequest(String endpointId) {
        RateLimitRule rule = rules.get(endpointId);
        if (rule == null) {
            return;
        }
        long bucket = bucket(rule);
        windows.merge(
            endpointId + ":" + bucket,
            new RateLimitWindow(endpointId, bucket, 1, rule.requests(), rule.period()),
            (current, ignored) -> current.increment());
    }

    /**
     * @return the window currently counting requests for the endpoint, if one exists
     */
    public synchronized RateLimitWindow currentWindow(String endpointId) {
        RateLimitRule rule = rules.get(endpointId);
        return rule == null ? null : windows.get(windowKey(endpointId, rule));
    }

    public synchronized int windowCount() {
        return windows.size();
    }

    public boolean isLimited(String endpointId) {
        return rules.containsKey(endpointId);
    }

    private String windowKey(String endpointId, RateLimitRule rule) {
        return endpointId + ":" + bucket(rule);
    }

    private long bucket(RateLimitRule rule) {
        return Math.floorDiv(clock.millis(), rule.period().toMillis());
    }
}

package com.sportsdata.application.ratelimit;

import java.time.Duration;

/**
 * Request count of one endpoint inside one fixed time bucket.
 *
 * @param endpointId endpoint the bucket belongs to
 * @param windowKey  bucket number, epoch millis divided by the period
 * @param count      requests recorded in the bucket
 * @param limit      budget of the bucket
 * @param period     bucket length
 */
public record RateLimitWindow(String endpointId, long windowKey, int count, int limit, Duration period) {

    public boolean hasCapacity() {
        return count < limit;
    }

    RateLimitWindow increment() {
        return new RateLimitWindow(endpointId, windowKey, count + 1, limit, period);
    }
}

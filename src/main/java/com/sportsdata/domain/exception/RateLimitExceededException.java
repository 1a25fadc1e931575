package com.sportsdata.domain.exception;

/**
 * Thrown when the request budget of an upstream endpoint is exhausted for the current window.
 */
public class RateLimitExceededException extends PipelineException {

    public RateLimitExceededException(String source) {
        super(source, "Rate limit exceeded");
    }
}

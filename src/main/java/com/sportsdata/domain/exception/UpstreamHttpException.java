package com.sportsdata.domain.exception;

/**
 * Thrown when an upstream provider answers with a non-success status, an unexpected
 * content type, or cannot be reached at all (status 0).
 */
public class UpstreamHttpException extends PipelineException {

    private final int statusCode;

    public UpstreamHttpException(String source, int statusCode, String message) {
        super(source, message);
        this.statusCode = statusCode;
    }

    public UpstreamHttpException(String source, String message, Throwable cause) {
        super(source, message, cause);
        this.statusCode = 0;
    }

    public int getStatusCode() {
        return statusCode;
    }
}

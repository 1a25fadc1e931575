package com.sportsdata.domain.exception;

/**
 * Base type for failures raised while serving a read through the pipeline.
 */
public class PipelineException extends RuntimeException {

    private final String source;

    public PipelineException(String source, String message) {
        super("[" + source + "] " + message);
        this.source = source;
    }

    public PipelineException(String source, String message, Throwable cause) {
        super("[" + source + "] " + message, cause);
        this.source = source;
    }

    /**
     * @return upstream source id the failure relates to (e.g. "sportradar")
     */
    public String getSource() {
        return source;
    }
}

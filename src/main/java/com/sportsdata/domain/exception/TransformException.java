package com.sportsdata.domain.exception;

/**
 * Thrown when a provider payload cannot be turned into its canonical shape.
 */
public class TransformException extends PipelineException {

    public TransformException(String source, String message) {
        super(source, message);
    }

    public TransformException(String source, String message, Throwable cause) {
        super(source, message, cause);
    }
}

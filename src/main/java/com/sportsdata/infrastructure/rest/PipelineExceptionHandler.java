package com.sportsdata.infrastructure.rest;

import com.sportsdata.domain.exception.PipelineException;
import com.sportsdata.domain.exception.RateLimitExceededException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.concurrent.CancellationException;

/**
 * Maps failed reads to HTTP statuses: exhausted budget 429, provider or payload failure 502,
 * pipeline shut down 503.
 */
@RestControllerAdvice
public class PipelineExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(PipelineExceptionHandler.class);

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ErrorResponse> handleRateLimit(RateLimitExceededException e) {
        logger.warn("Rejected read: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
            .body(new ErrorResponse(e.getSource(), e.getMessage()));
    }

    @ExceptionHandler(PipelineException.class)
    public ResponseEntity<ErrorResponse> handleUpstreamFailure(PipelineException e) {
        logger.error("Upstream read failed: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
            .body(new ErrorResponse(e.getSource(), e.getMessage()));
    }

    @ExceptionHandler({CancellationException.class, IllegalStateException.class})
    public ResponseEntity<ErrorResponse> handleUnavailable(RuntimeException e) {
        logger.error("Pipeline unavailable: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ErrorResponse(null, e.getMessage()));
    }
}

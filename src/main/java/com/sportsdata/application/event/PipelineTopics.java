package com.sportsdata.application.event;

/**
 * Topic names published by the pipeline.
 */
public final class PipelineTopics {

    public static final String DATA_UPDATED = "data:updated";
    public static final String ODDS_UPDATED = "odds:updated";
    public static final String ERROR = "error";
    public static final String CONNECTION_ESTABLISHED = "connection:established";
    public static final String CONNECTION_FAILED = "connection:failed";
    public static final String CACHE_CLEARED = "cache:cleared";
    public static final String REFRESH_STARTED = "refresh:started";
    public static final String REFRESH_COMPLETED = "refresh:completed";
    public static final String REFRESH_FAILED = "refresh:failed";
    public static final String SHUTDOWN = "shutdown";

    private PipelineTopics() {
    }
}

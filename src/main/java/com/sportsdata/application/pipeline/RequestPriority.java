package com.sportsdata.application.pipeline;

/**
 * Queue priority per data category. Lower values run first.
 */
public enum RequestPriority {
    CRITICAL(1),
    STANDARD(2),
    LOW(4);

    private final int value;

    RequestPriority(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }
}

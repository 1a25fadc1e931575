package com.sportsdata.domain.ports;

/**
 * Common contract of every upstream data provider.
 */
public interface UpstreamSource {

    /**
     * Gets the id of the source, also used as its rate-limit endpoint id.
     *
     * @return Source id (e.g., "sportradar", "the-odds-api", "weather")
     */
    String getSourceName();

    /**
     * Checks whether the source is usable with the current configuration.
     *
     * @return true if the source can be called
     */
    boolean isAvailable();
}

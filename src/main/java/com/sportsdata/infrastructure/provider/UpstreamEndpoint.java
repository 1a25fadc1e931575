package com.sportsdata.infrastructure.provider;

import java.time.Duration;

/**
 * Connection settings of one upstream provider.
 *
 * @param sourceName     source id, also the rate-limit endpoint id
 * @param baseUrl        scheme and host, without trailing slash
 * @param version        path version segment (e.g. "v7"), blank when the API has none
 * @param apiKey         key sent as a query parameter, may be blank
 * @param timeout        connect and response timeout
 * @param requiresApiKey whether calls without a key are pointless
 */
public record UpstreamEndpoint(
    String sourceName,
    String baseUrl,
    String version,
    String apiKey,
    Duration timeout,
    boolean requiresApiKey
) {

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    /**
     * A source is usable when its base URL is set and, if it needs one, its key is too.
     */
    public boolean isConfigured() {
        boolean hasBaseUrl = baseUrl != null && !baseUrl.isBlank();
        return hasBaseUrl && (!requiresApiKey || hasApiKey());
    }
}

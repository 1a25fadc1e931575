package com.sportsdata.infrastructure.provider;

import com.sportsdata.domain.ports.UpstreamSource;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base of the HTTP provider gateways: availability, URL assembly and API key handling.
 */
public abstract class HttpUpstreamGateway implements UpstreamSource {

    protected final UpstreamEndpoint endpoint;
    protected final UpstreamHttpClient httpClient;

    protected HttpUpstreamGateway(UpstreamEndpoint endpoint, UpstreamHttpClient httpClient) {
        this.endpoint = endpoint;
        this.httpClient = httpClient;
    }

    /**
     * @return name of the query parameter carrying the API key, or null if the API takes none
     */
    protected abstract String apiKeyParam();

    @Override
    public String getSourceName() {
        return endpoint.sourceName();
    }

    @Override
    public boolean isAvailable() {
        return endpoint.isConfigured();
    }

    protected <T> T get(String path, Map<String, String> params, Class<T> type) {
        Map<String, String> query = new LinkedHashMap<>();
        if (apiKeyParam() != null && endpoint.hasApiKey()) {
            query.put(apiKeyParam(), endpoint.apiKey());
        }
        query.putAll(params);

        String url = UpstreamHttpClient.buildUrl(endpoint.baseUrl(), endpoint.version(), path, query);
        return httpClient.getJson(endpoint.sourceName(), url, endpoint.timeout(), type);
    }
}

package com.sportsdata.infrastructure.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sportsdata.domain.exception.TransformException;
import com.sportsdata.domain.exception.UpstreamHttpException;
import org.apache.hc.client5.http.classic.methods.HttpGet;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.core5.http.ClassicHttpResponse;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.ParseException;
import org.apache.hc.core5.http.io.entity.EntityUtils;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * Blocking JSON GET client shared by all provider gateways.
 */
public class UpstreamHttpClient implements Closeable {

    private static final Logger logger = LoggerFactory.getLogger(UpstreamHttpClient.class);
    private static final int MAX_LOG_BODY_LENGTH = 500;

    private final CloseableHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public UpstreamHttpClient(ObjectMapper objectMapper) {
        this(HttpClients.createDefault(), objectMapper);
    }

    public UpstreamHttpClient(CloseableHttpClient httpClient, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    /**
     * Builds {@code baseUrl[/version]path?query}, URL-encoding the query parameters.
     */
    public static String buildUrl(String baseUrl, String version, String path, Map<String, String> params) {
        StringBuilder url = new StringBuilder(baseUrl);
        if (version != null && !version.isBlank()) {
            url.append('/').append(version);
        }
        url.append(path);

        if (params != null && !params.isEmpty()) {
            url.append('?');
            for (Map.Entry<String, String> entry : params.entrySet()) {
                url.append(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8))
                    .append('=')
                    .append(URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8))
                    .append('&');
            }
            url.setLength(url.length() - 1);
        }
        return url.toString();
    }

    /**
     * Percent-encodes one path segment, so ids with {@code /}, {@code ?}, {@code &} or spaces
     * stay inside their segment.
     */
    public static String pathSegment(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

    /**
     * Fetches {@code url} and binds the JSON body to {@code type}.
     *
     * @throws UpstreamHttpException on an invalid URL, I/O failure, non-2xx status or non-JSON content
     * @throws TransformException    when the body cannot be bound to {@code type}
     */
    public <T> T getJson(String source, String url, Duration timeout, Class<T> type) {
        HttpGet request;
        try {
            request = new HttpGet(url);
        } catch (IllegalArgumentException e) {
            logger.error("Invalid {} request URL {}", source, url);
            throw new UpstreamHttpException(source, "Invalid request URL: " + e.getMessage(), e);
        }
        request.addHeader("accept", "application/json");
        request.setConfig(RequestConfig.custom()
            .setConnectTimeout(Timeout.of(timeout))
            .setResponseTimeout(Timeout.of(timeout))
            .build());

        RawResponse response;
        try {
            response = httpClient.execute(request, this::readResponse);
        } catch (IOException e) {
            logger.error("Request to {} failed: {}", source, e.getMessage());
            throw new UpstreamHttpException(source, "Request failed: " + e.getMessage(), e);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            logger.error("{} request failed with status {}", source, response.statusCode());
            logResponseBodyPreview(response.body());
            throw new UpstreamHttpException(source, response.statusCode(),
                "HTTP request failed with status " + response.statusCode());
        }

        // a missing content type is still parsed as JSON
        String contentType = response.contentType();
        if (contentType != null && !contentType.isEmpty()
            && !contentType.toLowerCase().startsWith("application/json")) {
            logger.error("Expected JSON from {} but received content-type: {}", source, contentType);
            logResponseBodyPreview(response.body());
            throw new UpstreamHttpException(source, response.statusCode(),
                "Expected JSON response but received: " + contentType);
        }

        try {
            return objectMapper.readValue(response.body(), type);
        } catch (JsonProcessingException e) {
            logger.error("Failed to bind {} response to {}", source, type.getSimpleName());
            logResponseBodyPreview(response.body());
            throw new TransformException(source, "Unreadable " + type.getSimpleName() + ": " + e.getOriginalMessage(), e);
        }
    }

    @Override
    public void close() throws IOException {
        httpClient.close();
    }

    private RawResponse readResponse(ClassicHttpResponse response) throws IOException {
        HttpEntity entity = response.getEntity();
        String contentType = entity != null ? entity.getContentType() : null;
        String body;
        try {
            body = entity != null ? EntityUtils.toString(entity, StandardCharsets.UTF_8) : "";
        } catch (ParseException e) {
            throw new IOException("Failed to parse response", e);
        }
        return new RawResponse(response.getCode(), contentType, body);
    }

    private static void logResponseBodyPreview(String responseBody) {
        String preview = responseBody.length() > MAX_LOG_BODY_LENGTH
            ? responseBody.substring(0, MAX_LOG_BODY_LENGTH) + "..."
            : responseBody;
        logger.error("Response body preview: {}", preview);
    }

    private record RawResponse(int statusCode, String contentType, String body) {}
}

package com.sportsdata.infrastructure.rest;

/**
 * Error body returned by the REST facade.
 *
 * @param source upstream source id, null when the failure is not tied to a provider
 */
public record ErrorResponse(String source, String message) {}

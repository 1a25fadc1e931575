package com.sportsdata.infrastructure.provider.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * WeatherAPI current conditions ({@code GET /current.json?q=}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record WeatherApiPayload(Location location, Current current) implements ProviderPayload {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Location(String name, String region, String country) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Current(
        @JsonProperty("temp_f") Double tempF,
        Double humidity,
        @JsonProperty("wind_mph") Double windMph,
        @JsonProperty("wind_degree") Double windDegree,
        @JsonProperty("precip_in") Double precipIn,
        @JsonProperty("vis_miles") Double visMiles,
        Condition condition
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Condition(String text) {}
}

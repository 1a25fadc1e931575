package com.sportsdata.domain.model;

/**
 * Current weather conditions at a venue, imperial units.
 */
public record WeatherData(
    double temperature,
    double humidity,
    double windSpeed,
    double windDirection,
    double precipitation,
    double visibility,
    String conditions
) {}

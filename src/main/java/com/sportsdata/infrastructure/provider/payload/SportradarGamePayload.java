package com.sportsdata.infrastructure.provider.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Sportradar game summary ({@code GET /games/{id}}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SportradarGamePayload(
    String id,
    String sport,
    League league,
    @JsonProperty("home_team") Team homeTeam,
    @JsonProperty("away_team") Team awayTeam,
    String scheduled,
    String status,
    Venue venue
) implements ProviderPayload {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record League(String id, String name) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Team(
        String id,
        String name,
        String alias,
        String market,
        Integer wins,
        Integer losses,
        Integer ties
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Venue(String id, String name, String city, String state, Integer capacity) {}
}

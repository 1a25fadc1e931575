package com.sportsdata.infrastructure.provider.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * The Odds API event odds ({@code GET /sports/{sport}/events/{eventId}/odds}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record OddsApiEventPayload(
    String id,
    @JsonProperty("sport_key") String sportKey,
    @JsonProperty("commence_time") Instant commenceTime,
    @JsonProperty("home_team") String homeTeam,
    @JsonProperty("away_team") String awayTeam,
    List<Bookmaker> bookmakers
) implements ProviderPayload {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Bookmaker(
        String key,
        String title,
        @JsonProperty("last_update") Instant lastUpdate,
        List<Market> markets
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Market(
        String key,
        @JsonProperty("last_update") Instant lastUpdate,
        List<Outcome> outcomes
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Outcome(String name, BigDecimal price, BigDecimal point) {}
}

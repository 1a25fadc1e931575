package com.sportsdata.infrastructure.provider.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Sportradar player profile ({@code GET /players/{id}}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SportradarPlayerPayload(
    String id,
    @JsonProperty("full_name") String fullName,
    String name,
    String position,
    TeamRef team,
    @JsonProperty("jersey_number") Integer jerseyNumber,
    Integer jersey,
    Statistics statistics
) implements ProviderPayload {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TeamRef(String id, String name) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Statistics(
        @JsonProperty("games_played") Integer gamesPlayed,
        Map<String, Double> averages,
        @JsonProperty("per_36") Map<String, Double> per36,
        Map<String, Double> advanced,
        Map<String, Double> totals
    ) {}
}

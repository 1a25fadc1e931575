package com.sportsdata.domain.model;

import java.util.Map;

/**
 * Statistical summary of a player. Each map is keyed by the provider's stat name.
 */
public record PlayerStats(
    int gamesPlayed,
    Map<String, Double> averages,
    Map<String, Double> per36,
    Map<String, Double> advanced,
    Map<String, Double> seasonTotals
) {

    public PlayerStats {
        averages = averages == null ? Map.of() : Map.copyOf(averages);
        per36 = per36 == null ? Map.of() : Map.copyOf(per36);
        advanced = advanced == null ? Map.of() : Map.copyOf(advanced);
        seasonTotals = seasonTotals == null ? Map.of() : Map.copyOf(seasonTotals);
    }

    public static PlayerStats empty() {
        return new PlayerStats(0, Map.of(), Map.of(), Map.of(), Map.of());
    }
}

package com.sportsdata.application.pipeline;

import java.time.Duration;
import java.util.List;

/**
 * Tunables of the {@link PipelineOrchestrator}.
 *
 * @param ttls                 cache lifetime per data category
 * @param intervals            background job rates
 * @param features             feature flags
 * @param sports               sport keys refreshed by the injury job
 * @param shutdownDrainTimeout how long shutdown waits for enqueued reads to settle
 */
public record PipelineSettings(
    Ttls ttls,
    Intervals intervals,
    Features features,
    List<String> sports,
    Duration shutdownDrainTimeout
) {

    public static final List<String> DEFAULT_SPORTS = List.of("nba", "wnba", "mlb", "epl", "nfl", "ncaab");

    public PipelineSettings {
        sports = sports == null ? List.of() : List.copyOf(sports);
    }

    public static PipelineSettings defaults() {
        return new PipelineSettings(
            Ttls.defaults(), Intervals.defaults(), Features.allEnabled(),
            DEFAULT_SPORTS, Duration.ofSeconds(5));
    }

    public PipelineSettings withFeatures(Features features) {
        return new PipelineSettings(ttls, intervals, features, sports, shutdownDrainTimeout);
    }

    public record Ttls(
        Duration game,
        Duration player,
        Duration odds,
        Duration projections,
        Duration injuries,
        Duration weather
    ) {

        public static Ttls defaults() {
            return new Ttls(Duration.ofHours(1), Duration.ofMinutes(5), Duration.ofSeconds(30),
                Duration.ofMinutes(5), Duration.ofMinutes(30), Duration.ofMinutes(30));
        }
    }

    public record Intervals(Duration odds, Duration liveGames, Duration injuries) {

        public static Intervals defaults() {
            return new Intervals(Duration.ofSeconds(30), Duration.ofSeconds(15), Duration.ofMinutes(30));
        }
    }

    public record Features(
        boolean realTimeOdds,
        boolean liveGames,
        boolean injuryTracking,
        boolean weatherIntegration
    ) {

        public static Features allEnabled() {
            return new Features(true, true, true, true);
        }
    }
}

package com.sportsdata.infrastructure.rest;

import com.sportsdata.application.cache.CacheStats;
import com.sportsdata.application.pipeline.PipelineOrchestrator;
import com.sportsdata.domain.model.GameData;
import com.sportsdata.domain.model.InjuryData;
import com.sportsdata.domain.model.MarketData;
import com.sportsdata.domain.model.OddsData;
import com.sportsdata.domain.model.PlayerData;
import com.sportsdata.domain.model.Projection;
import com.sportsdata.domain.model.WeatherData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * REST facade over the pipeline reads and management operations.
 * Failed reads are translated by {@link PipelineExceptionHandler}.
 */
@RestController
@RequestMapping("/api/v1")
public class PipelineController {

    private static final Logger logger = LoggerFactory.getLogger(PipelineController.class);

    private final PipelineOrchestrator orchestrator;

    public PipelineController(PipelineOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @GetMapping("/games/{gameId}")
    public ResponseEntity<GameData> getGame(@PathVariable String gameId) {
        return ResponseEntity.ok(await(orchestrator.getGameData(gameId)));
    }

    @GetMapping("/players/{playerId}")
    public ResponseEntity<PlayerData> getPlayer(@PathVariable String playerId) {
        return ResponseEntity.ok(await(orchestrator.getPlayerData(playerId)));
    }

    @GetMapping("/odds/{eventId}")
    public ResponseEntity<List<OddsData>> getOdds(
        @PathVariable String eventId,
        @RequestParam(required = false) String market
    ) {
        return ResponseEntity.ok(await(orchestrator.getLiveOdds(eventId, market)));
    }

    @GetMapping("/markets/{eventId}")
    public ResponseEntity<MarketData> getMarket(
        @PathVariable String eventId,
        @RequestParam(defaultValue = "h2h") String market
    ) {
        return ResponseEntity.ok(await(orchestrator.getMarketData(eventId, market)));
    }

    @GetMapping("/projections")
    public ResponseEntity<List<Projection>> getProjections() {
        return ResponseEntity.ok(await(orchestrator.getPrizePicksProjections()));
    }

    @GetMapping("/injuries/{sport}")
    public ResponseEntity<List<InjuryData>> getInjuries(@PathVariable String sport) {
        return ResponseEntity.ok(await(orchestrator.getInjuries(sport.toLowerCase())));
    }

    /**
     * 204 when weather integration is switched off.
     */
    @GetMapping("/weather/{venueId}")
    public ResponseEntity<WeatherData> getWeather(@PathVariable String venueId) {
        Optional<WeatherData> weather = await(orchestrator.getWeatherData(venueId));
        return weather.map(ResponseEntity::ok).orElseGet(() -> ResponseEntity.noContent().build());
    }

    @DeleteMapping("/pipeline/cache")
    public ResponseEntity<Void> clearCache() {
        logger.info("Received request to clear the cache");
        orchestrator.clearCache();
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/pipeline/cache/stats")
    public ResponseEntity<CacheStats> getCacheStats() {
        return ResponseEntity.ok(orchestrator.getCacheStats());
    }

    @GetMapping("/pipeline/connections")
    public ResponseEntity<Map<String, Boolean>> getConnections() {
        return ResponseEntity.ok(orchestrator.getConnectionStatus());
    }

    /**
     * Starts a full refresh and returns without waiting for it. The outcome is published as
     * {@code refresh:completed} or {@code refresh:failed}.
     */
    @PostMapping("/pipeline/refresh")
    public ResponseEntity<Void> refresh() {
        logger.info("Received request to refresh all data");
        orchestrator.refreshAllData();
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/pipeline/tracked-events/{eventId}")
    public ResponseEntity<Void> trackEvent(@PathVariable String eventId) {
        orchestrator.trackEvent(eventId);
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/pipeline/tracked-events/{eventId}")
    public ResponseEntity<Void> untrackEvent(@PathVariable String eventId) {
        return orchestrator.untrack(eventId)
            ? ResponseEntity.noContent().build()
            : ResponseEntity.notFound().build();
    }

    private static <T> T await(CompletableFuture<T> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }
}

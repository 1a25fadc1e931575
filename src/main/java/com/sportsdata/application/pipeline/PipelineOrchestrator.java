package com.sportsdata.application.pipeline;

import com.sportsdata.application.cache.CacheStats;
import com.sportsdata.application.cache.DataCache;
import com.sportsdata.application.event.EventBus;
import com.sportsdata.application.event.OddsUpdate;
import com.sportsdata.application.event.PipelineEvent;
import com.sportsdata.application.event.PipelineEvent.ConnectionChanged;
import com.sportsdata.application.event.PipelineEvent.DataUpdated;
import com.sportsdata.application.event.PipelineEvent.Lifecycle;
import com.sportsdata.application.event.PipelineEvent.PipelineError;
import com.sportsdata.application.event.PipelineTopics;
import com.sportsdata.application.event.Subscription;
import com.sportsdata.application.queue.RequestQueue;
import com.sportsdata.application.ratelimit.RateLimiter;
import com.sportsdata.domain.exception.RateLimitExceededException;
import com.sportsdata.domain.model.GameData;
import com.sportsdata.domain.model.InjuryData;
import com.sportsdata.domain.model.MarketData;
import com.sportsdata.domain.model.OddsData;
import com.sportsdata.domain.model.PlayerData;
import com.sportsdata.domain.model.Projection;
import com.sportsdata.domain.model.WeatherData;
import com.sportsdata.domain.ports.InjuryGateway;
import com.sportsdata.domain.ports.OddsGateway;
import com.sportsdata.domain.ports.ProjectionsGateway;
import com.sportsdata.domain.ports.SportsStatsGateway;
import com.sportsdata.domain.ports.UpstreamSource;
import com.sportsdata.domain.ports.WeatherGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Cache-first read API over all upstream providers.
 *
 * <p>Every read checks the {@link DataCache} first. A miss becomes a task on the
 * {@link RequestQueue}; inside the task the endpoint budget is checked and counted, the
 * gateway is called, the result is cached with the category TTL and announced on the
 * event bus. Background jobs keep tracked events, live games and injury reports warm
 * through the same path.
 *
 * <p>Reads are not de-duplicated: two concurrent misses for one key fetch twice.
 */
public class PipelineOrchestrator {

    private static final Logger logger = LoggerFactory.getLogger(PipelineOrchestrator.class);

    static final String ALL_MARKETS = "all";

    private final DataCache<String, Object> cache;
    private final RateLimiter rateLimiter;
    private final RequestQueue queue;
    private final EventBus<PipelineEvent> events;
    private final EventBus<OddsUpdate> oddsBus;
    private final RefreshScheduler scheduler;
    private final ActiveEntityTracker tracker;
    private final SportsStatsGateway statsGateway;
    private final OddsGateway oddsGateway;
    private final ProjectionsGateway projectionsGateway;
    private final InjuryGateway injuryGateway;
    private final WeatherGateway weatherGateway;
    private final PipelineSettings settings;
    private final Clock clock;

    private final Map<String, Boolean> connections = new LinkedHashMap<>();

    public PipelineOrchestrator(
        DataCache<String, Object> cache,
        RateLimiter rateLimiter,
        RequestQueue queue,
        EventBus<PipelineEvent> events,
        EventBus<OddsUpdate> oddsBus,
        RefreshScheduler scheduler,
        ActiveEntityTracker tracker,
        SportsStatsGateway statsGateway,
        OddsGateway oddsGateway,
        ProjectionsGateway projectionsGateway,
        InjuryGateway injuryGateway,
        WeatherGateway weatherGateway,
        PipelineSettings settings,
        Clock clock
    ) {
        this.cache = cache;
        this.rateLimiter = rateLimiter;
        this.queue = queue;
        this.events = events;
        this.oddsBus = oddsBus;
        this.scheduler = scheduler;
        this.tracker = tracker;
        this.statsGateway = statsGateway;
        this.oddsGateway = oddsGateway;
        this.projectionsGateway = projectionsGateway;
        this.injuryGateway = injuryGateway;
        this.weatherGateway = weatherGateway;
        this.settings = settings;
        this.clock = clock;
    }

    // Lifecycle

    /**
     * Probes every upstream source, then starts the background jobs enabled by the
     * feature flags. The probe result is informational; unavailable sources are still called.
     */
    public void start() {
        logger.info("Starting sports data pipeline");
        probeConnections();

        List<RefreshScheduler.RefreshJob> jobs = new ArrayList<>();
        PipelineSettings.Features features = settings.features();
        PipelineSettings.Intervals intervals = settings.intervals();
        if (features.realTimeOdds()) {
            jobs.add(new RefreshScheduler.RefreshJob("odds", intervals.odds(), this::refreshTrackedOdds));
        }
        if (features.liveGames()) {
            jobs.add(new RefreshScheduler.RefreshJob("live_games", intervals.liveGames(), this::refreshLiveGames));
        }
        if (features.injuryTracking()) {
            jobs.add(new RefreshScheduler.RefreshJob("injuries", intervals.injuries(), this::refreshInjuryReports));
        }
        scheduler.start(jobs);
        logger.info("Sports data pipeline started with {} background jobs", jobs.size());
    }

    /**
     * Stops the background jobs, waits for already enqueued reads to settle, then drops
     * cached data and connection state. Reads keep working afterwards from a cold cache.
     */
    public void shutdown() {
        logger.info("Shutting down sports data pipeline");
        scheduler.stop();

        try {
            if (!scheduler.awaitTermination(settings.shutdownDrainTimeout())) {
                logger.warn("Background jobs still running after {}ms", settings.shutdownDrainTimeout().toMillis());
            }
            if (!queue.awaitIdle(settings.shutdownDrainTimeout())) {
                logger.warn("Request queue still busy after {}ms, {} tasks pending",
                    settings.shutdownDrainTimeout().toMillis(), queue.size());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for background work to finish");
        }

        clearCache();
        synchronized (connections) {
            connections.clear();
        }
        events.publish(PipelineTopics.SHUTDOWN, Lifecycle.ok());
        logger.info("Sports data pipeline shut down");
    }

    // Reads

    public CompletableFuture<GameData> getGameData(String gameId) {
        return read("game", gameId, "game:" + gameId, RequestPriority.STANDARD, statsGateway,
            settings.ttls().game(), () -> statsGateway.fetchGame(gameId), tracker::onGame);
    }

    public CompletableFuture<PlayerData> getPlayerData(String playerId) {
        return read("player", playerId, "player:" + playerId, RequestPriority.STANDARD, statsGateway,
            settings.ttls().player(), () -> statsGateway.fetchPlayer(playerId));
    }

    public CompletableFuture<List<OddsData>> getLiveOdds(String eventId) {
        return getLiveOdds(eventId, null);
    }

    /**
     * @param market market key to restrict to, or null for every market the provider returns
     */
    public CompletableFuture<List<OddsData>> getLiveOdds(String eventId, String market) {
        String marketKey = market == null || market.isBlank() ? ALL_MARKETS : market;
        String requested = ALL_MARKETS.equals(marketKey) ? null : marketKey;
        return read("odds", eventId, "odds:" + eventId + ":" + marketKey, RequestPriority.CRITICAL, oddsGateway,
            settings.ttls().odds(), () -> oddsGateway.fetchOdds(eventId, requested),
            odds -> oddsBus.publish(PipelineTopics.ODDS_UPDATED, new OddsUpdate(eventId, marketKey, odds)));
    }

    /**
     * Aggregates the live odds of one market. Served from the same cache entry as
     * {@link #getLiveOdds(String, String)}.
     */
    public CompletableFuture<MarketData> getMarketData(String eventId, String market) {
        return getLiveOdds(eventId, market)
            .thenApply(odds -> MarketAggregator.aggregate(eventId, market, odds, clock.instant()));
    }

    public CompletableFuture<List<Projection>> getPrizePicksProjections() {
        return read("projections", "prizepicks", "prizepicks:projections", RequestPriority.STANDARD,
            projectionsGateway, settings.ttls().projections(), projectionsGateway::fetchProjections);
    }

    public CompletableFuture<List<InjuryData>> getInjuries(String sport) {
        return read("injuries", sport, "injuries:" + sport, RequestPriority.STANDARD, injuryGateway,
            settings.ttls().injuries(), () -> injuryGateway.fetchInjuries(sport));
    }

    /**
     * @return empty without contacting the provider when weather integration is disabled
     */
    public CompletableFuture<Optional<WeatherData>> getWeatherData(String venueId) {
        if (!settings.features().weatherIntegration()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        return read("weather", venueId, "weather:" + venueId, RequestPriority.LOW, weatherGateway,
            settings.ttls().weather(), () -> weatherGateway.fetchWeather(venueId))
            .thenApply(Optional::of);
    }

    // Management

    public void clearCache() {
        cache.clear();
        events.publish(PipelineTopics.CACHE_CLEARED, Lifecycle.ok());
        logger.info("Cache cleared");
    }

    public CacheStats getCacheStats() {
        return cache.stats();
    }

    public Map<String, Boolean> getConnectionStatus() {
        synchronized (connections) {
            return Collections.unmodifiableMap(new LinkedHashMap<>(connections));
        }
    }

    /**
     * Clears the cache and re-reads tracked games, tracked events' odds and the injury report
     * of every configured sport. The returned future always completes normally; a failure is
     * reported as {@code refresh:failed}.
     */
    public CompletableFuture<Void> refreshAllData() {
        clearCache();
        events.publish(PipelineTopics.REFRESH_STARTED, Lifecycle.ok());

        List<CompletableFuture<?>> reads = new ArrayList<>();
        tracker.liveGames().forEach(id -> reads.add(getGameData(id)));
        tracker.activeEvents().forEach(id -> reads.add(getLiveOdds(id)));
        settings.sports().forEach(sport -> reads.add(getInjuries(sport)));
        logger.info("Refreshing all data: {} reads enqueued", reads.size());

        return CompletableFuture.allOf(reads.toArray(new CompletableFuture[0]))
            .handle((ignored, failure) -> {
                if (failure == null) {
                    events.publish(PipelineTopics.REFRESH_COMPLETED, Lifecycle.ok());
                    logger.info("Refresh completed");
                } else {
                    Throwable cause = failure.getCause() != null ? failure.getCause() : failure;
                    events.publish(PipelineTopics.REFRESH_FAILED, Lifecycle.failed(cause));
                    logger.warn("Refresh failed: {}", cause.getMessage());
                }
                return null;
            });
    }

    public void trackEvent(String eventId) {
        tracker.trackEvent(eventId);
    }

    public void trackLiveGame(String gameId) {
        tracker.trackLiveGame(gameId);
    }

    public boolean untrack(String id) {
        return tracker.untrack(id);
    }

    public Subscription subscribe(String topic, Consumer<? super PipelineEvent> listener) {
        return events.subscribe(topic, listener);
    }

    public boolean unsubscribe(String topic, Consumer<? super PipelineEvent> listener) {
        return events.unsubscribe(topic, listener);
    }

    // Internals

    private <T> CompletableFuture<T> read(
        String type,
        String id,
        String cacheKey,
        RequestPriority priority,
        UpstreamSource source,
        Duration ttl,
        Supplier<T> fetch
    ) {
        return read(type, id, cacheKey, priority, source, ttl, fetch, value -> {
        });
    }

    @SuppressWarnings("unchecked")
    private <T> CompletableFuture<T> read(
        String type,
        String id,
        String cacheKey,
        RequestPriority priority,
        UpstreamSource source,
        Duration ttl,
        Supplier<T> fetch,
        Consumer<T> onFetched
    ) {
        Optional<Object> cached = cache.get(cacheKey);
        if (cached.isPresent()) {
            logger.debug("Cache hit {}", cacheKey);
            return CompletableFuture.completedFuture((T) cached.get());
        }

        String taskId = type + "-" + id;
        return queue.enqueue(taskId, priority.value(), () -> {
            String endpoint = source.getSourceName();
            try {
                if (!rateLimiter.canMakeRequest(endpoint)) {
                    throw new RateLimitExceededException(endpoint);
                }
                rateLimiter.recordRequest(endpoint);

                T value = fetch.get();
                cache.set(cacheKey, value, ttl);
                events.publish(PipelineTopics.DATA_UPDATED, new DataUpdated(type, id, value));
                onFetched.accept(value);
                return value;
            } catch (RuntimeException e) {
                logger.warn("Read {} from {} failed: {}", taskId, endpoint, e.getMessage());
                throw e;
            }
        });
    }

    private void probeConnections() {
        for (UpstreamSource source : List.of(statsGateway, oddsGateway, projectionsGateway, injuryGateway, weatherGateway)) {
            String name = source.getSourceName();
            boolean available;
            String reason = null;
            try {
                available = source.isAvailable();
                if (!available) {
                    reason = "Source " + name + " is not configured";
                }
            } catch (RuntimeException e) {
                available = false;
                reason = e.getMessage();
            }

            synchronized (connections) {
                connections.put(name, available);
            }
            if (available) {
                events.publish(PipelineTopics.CONNECTION_ESTABLISHED, new ConnectionChanged(name, true, null));
                logger.info("Connection to {} established", name);
            } else {
                events.publish(PipelineTopics.CONNECTION_FAILED, new ConnectionChanged(name, false, reason));
                logger.warn("Connection to {} failed: {}", name, reason);
            }
        }
    }

    private void refreshTrackedOdds() {
        runJob("odds_stream", "live_odds_fetch", tracker::activeEvents, this::getLiveOdds);
    }

    private void refreshLiveGames() {
        runJob("live_games", "live_game_fetch", tracker::liveGames, this::getGameData);
    }

    private void refreshInjuryReports() {
        runJob("injury_updates", "injury_fetch", settings::sports, this::getInjuries);
    }

    /**
     * One tick of a background job: reads every id in turn, waiting for each. Item failures
     * and loop failures become error events; nothing escapes to the scheduler.
     */
    private void runJob(
        String loopErrorType,
        String itemErrorType,
        Supplier<List<String>> ids,
        Function<String, CompletableFuture<?>> read
    ) {
        try {
            for (String id : ids.get()) {
                if (!scheduler.isRunning()) {
                    return;
                }
                try {
                    read.apply(id).get();
                } catch (ExecutionException e) {
                    reportError(itemErrorType, id, e.getCause());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            reportError(loopErrorType, null, e);
        }
    }

    private void reportError(String type, String context, Throwable error) {
        logger.warn("Background refresh {} failed for {}: {}", type, context, error.getMessage());
        events.publish(PipelineTopics.ERROR, new PipelineError(type, context, error));
    }
}

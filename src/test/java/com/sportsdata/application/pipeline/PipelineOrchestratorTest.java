package com.sportsdata.application.pipeline;

import com.sportsdata.application.cache.DataCache;
import com.sportsdata.application.event.EventBus;
import com.sportsdata.application.event.OddsUpdate;
import com.sportsdata.application.event.PipelineEvent;
import com.sportsdata.application.event.PipelineTopics;
import com.sportsdata.application.queue.RequestQueue;
import com.sportsdata.application.ratelimit.RateLimitRule;
import com.sportsdata.application.ratelimit.RateLimiter;
import com.sportsdata.domain.exception.RateLimitExceededException;
import com.sportsdata.domain.exception.UpstreamHttpException;
import com.sportsdata.domain.model.GameData;
import com.sportsdata.domain.model.GameStatus;
import com.sportsdata.domain.model.MarketData;
import com.sportsdata.domain.model.OddsData;
import com.sportsdata.domain.model.WeatherData;
import com.sportsdata.support.FakeGateways.FakeInjuryGateway;
import com.sportsdata.support.FakeGateways.FakeOddsGateway;
import com.sportsdata.support.FakeGateways.FakeProjectionsGateway;
import com.sportsdata.support.FakeGateways.FakeStatsGateway;
import com.sportsdata.support.FakeGateways.FakeWeatherGateway;
import com.sportsdata.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PipelineOrchestrator, wired with in-memory gateways.
 */
class PipelineOrchestratorTest {

    private MutableClock clock;
    private DataCache<String, Object> cache;
    private RateLimiter orchestratorRateLimiter;
    private RequestQueue queue;
    private EventBus<PipelineEvent> events;
    private EventBus<OddsUpdate> oddsBus;
    private ThreadPoolTaskScheduler taskScheduler;
    private ActiveEntityTracker tracker;

    private FakeStatsGateway stats;
    private FakeOddsGateway odds;
    private FakeProjectionsGateway projections;
    private FakeInjuryGateway injuries;
    private FakeWeatherGateway weather;

    private PipelineOrchestrator orchestrator;
    private List<Published> published;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-01T12:00:00Z"));
        stats = new FakeStatsGateway();
        odds = new FakeOddsGateway();
        projections = new FakeProjectionsGateway();
        injuries = new FakeInjuryGateway();
        weather = new FakeWeatherGateway();
        published = Collections.synchronizedList(new ArrayList<>());

        orchestrator = build(PipelineSettings.defaults(), clock, Map.of(
            "the-odds-api", new RateLimitRule(2, Duration.ofMillis(1000)),
            "sportradar", new RateLimitRule(1000, Duration.ofSeconds(60))));
    }

    @AfterEach
    void tearDown() {
        orchestrator.shutdown();
        queue.close();
        taskScheduler.shutdown();
    }

    @Test
    void testLiveOddsMissFetchesCachesAndPublishes() throws Exception {
        List<OddsUpdate> oddsUpdates = Collections.synchronizedList(new ArrayList<>());
        oddsBus.subscribe(PipelineTopics.ODDS_UPDATED, oddsUpdates::add);

        List<OddsData> result = orchestrator.getLiveOdds("evt-1").get(5, TimeUnit.SECONDS);

        assertEquals(2, result.size());
        assertEquals(1, odds.fetchCount());
        assertTrue(cache.has("odds:evt-1:all"));

        PipelineEvent.DataUpdated updated = (PipelineEvent.DataUpdated) single(PipelineTopics.DATA_UPDATED);
        assertEquals("odds", updated.type());
        assertEquals("evt-1", updated.id());
        assertEquals(result, updated.data());

        assertEquals(1, oddsUpdates.size());
        assertEquals("all", oddsUpdates.get(0).market());
        assertEquals("evt-1", oddsUpdates.get(0).eventId());
    }

    @Test
    void testCacheHitSkipsUpstream() throws Exception {
        orchestrator.getGameData("g1").get(5, TimeUnit.SECONDS);

        CompletableFuture<GameData> second = orchestrator.getGameData("g1");

        assertTrue(second.isDone());
        assertEquals("g1", second.get().id());
        assertEquals(1, stats.fetchCount());
        assertEquals(1, orchestrator.getCacheStats().hits());
    }

    @Test
    void testMarketSpecificOddsUseTheirOwnCacheKey() throws Exception {
        orchestrator.getLiveOdds("evt-1", "h2h").get(5, TimeUnit.SECONDS);

        assertTrue(cache.has("odds:evt-1:h2h"));
        assertFalse(cache.has("odds:evt-1:all"));
    }

    @Test
    void testExpiredEntryIsFetchedAgain() throws Exception {
        orchestrator.getPlayerData("p1").get(5, TimeUnit.SECONDS);

        clock.advance(Duration.ofMinutes(5).plusMillis(1));
        orchestrator.getPlayerData("p1").get(5, TimeUnit.SECONDS);

        assertEquals(2, stats.fetchCount());
    }

    @Test
    void testThirdReadInWindowIsRateLimited() throws Exception {
        orchestrator.getLiveOdds("evt-1").get(5, TimeUnit.SECONDS);
        orchestrator.getLiveOdds("evt-2").get(5, TimeUnit.SECONDS);

        ExecutionException e = assertThrows(ExecutionException.class,
            () -> orchestrator.getLiveOdds("evt-3").get(5, TimeUnit.SECONDS));

        assertInstanceOf(RateLimitExceededException.class, e.getCause());
        assertEquals(2, odds.fetchCount());
        assertFalse(cache.has("odds:evt-3:all"));

        clock.advance(Duration.ofMillis(1000));
        orchestrator.getLiveOdds("evt-3").get(5, TimeUnit.SECONDS);
        assertEquals(3, odds.fetchCount());
    }

    @Test
    void testFailedFetchCountsAgainstBudgetAndCachesNothing() {
        odds.failWith(new UpstreamHttpException("the-odds-api", 503, "HTTP request failed with status 503"));

        ExecutionException e = assertThrows(ExecutionException.class,
            () -> orchestrator.getLiveOdds("evt-1").get(5, TimeUnit.SECONDS));

        assertInstanceOf(UpstreamHttpException.class, e.getCause());
        assertEquals(0, cache.size());
        assertTrue(ofTopic(PipelineTopics.DATA_UPDATED).isEmpty());
        assertEquals(1, orchestratorRateLimiter.currentWindow("the-odds-api").count());
    }

    @Test
    void testConcurrentMissesAreNotDeduplicated() throws Exception {
        CountDownLatch gate = stats.block();

        CompletableFuture<GameData> first = orchestrator.getGameData("g1");
        CompletableFuture<GameData> second = orchestrator.getGameData("g1");
        gate.countDown();

        first.get(5, TimeUnit.SECONDS);
        second.get(5, TimeUnit.SECONDS);
        assertEquals(2, stats.fetchCount());
    }

    @Test
    void testGameReadsUpdateTracking() throws Exception {
        stats.setStatus("g-live", GameStatus.LIVE);
        stats.setStatus("g-done", GameStatus.FINISHED);
        orchestrator.trackEvent("g-done");

        orchestrator.getGameData("g-live").get(5, TimeUnit.SECONDS);
        orchestrator.getGameData("g-done").get(5, TimeUnit.SECONDS);

        assertEquals(List.of("g-live"), tracker.liveGames());
        assertEquals(List.of("g-live"), tracker.activeEvents());
    }

    @Test
    void testWeatherDisabledSkipsUpstream() throws Exception {
        tearDown();
        PipelineSettings.Features noWeather = new PipelineSettings.Features(true, true, true, false);
        orchestrator = build(PipelineSettings.defaults().withFeatures(noWeather), clock, Map.of());

        Optional<WeatherData> result = orchestrator.getWeatherData("venue-1").get(5, TimeUnit.SECONDS);

        assertTrue(result.isEmpty());
        assertEquals(0, weather.fetchCount());
    }

    @Test
    void testWeatherEnabledFetches() throws Exception {
        Optional<WeatherData> result = orchestrator.getWeatherData("venue-1").get(5, TimeUnit.SECONDS);

        assertEquals("Sunny", result.orElseThrow().conditions());
        assertTrue(cache.has("weather:venue-1"));
    }

    @Test
    void testProjectionsAndInjuriesAreCached() throws Exception {
        assertEquals(1, orchestrator.getPrizePicksProjections().get(5, TimeUnit.SECONDS).size());
        assertEquals("nba-player", orchestrator.getInjuries("nba").get(5, TimeUnit.SECONDS).get(0).playerId());

        assertTrue(cache.has("prizepicks:projections"));
        assertTrue(cache.has("injuries:nba"));
    }

    @Test
    void testMarketDataAggregatesLiveOdds() throws Exception {
        MarketData market = orchestrator.getMarketData("evt-1", "h2h").get(5, TimeUnit.SECONDS);

        assertEquals(2, market.bookmakerCount());
        assertEquals(new BigDecimal("-110"), market.bestPrices().get("Lakers").price());
        assertEquals(clock.instant(), market.capturedAt());
        assertTrue(cache.has("odds:evt-1:h2h"));
    }

    @Test
    void testStartProbesEverySource() {
        stats.setAvailable(false);

        orchestrator.start();

        Map<String, Boolean> status = orchestrator.getConnectionStatus();
        assertEquals(5, status.size());
        assertFalse(status.get("sportradar"));
        assertTrue(status.get("the-odds-api"));
        assertEquals(4, ofTopic(PipelineTopics.CONNECTION_ESTABLISHED).size());

        PipelineEvent.ConnectionChanged failed = (PipelineEvent.ConnectionChanged) single(PipelineTopics.CONNECTION_FAILED);
        assertEquals("sportradar", failed.source());
        assertNotNull(failed.reason());
        assertThrows(UnsupportedOperationException.class, () -> status.put("x", true));
    }

    @Test
    void testUnavailableSourceIsStillCalled() throws Exception {
        stats.setAvailable(false);
        orchestrator.start();

        orchestrator.getGameData("g1").get(5, TimeUnit.SECONDS);

        assertEquals(1, stats.fetchCount());
    }

    @Test
    void testClearCache() throws Exception {
        orchestrator.getGameData("g1").get(5, TimeUnit.SECONDS);

        orchestrator.clearCache();

        assertEquals(0, orchestrator.getCacheStats().size());
        assertEquals(1, ofTopic(PipelineTopics.CACHE_CLEARED).size());
    }

    @Test
    void testRefreshAllDataRefetchesTrackedEntities() throws Exception {
        orchestrator.trackLiveGame("g1");
        orchestrator.trackEvent("evt-1");
        orchestrator.getInjuries("nba").get(5, TimeUnit.SECONDS);

        orchestrator.refreshAllData().get(5, TimeUnit.SECONDS);

        assertEquals(1, stats.fetchCount());
        // g1 is both live and active, so its odds are refreshed too
        assertEquals(2, odds.fetchCount());
        assertEquals(1 + PipelineSettings.DEFAULT_SPORTS.size(), injuries.fetchCount());
        assertEquals(1, ofTopic(PipelineTopics.REFRESH_STARTED).size());
        assertEquals(1, ofTopic(PipelineTopics.REFRESH_COMPLETED).size());
        assertTrue(ofTopic(PipelineTopics.REFRESH_FAILED).isEmpty());
    }

    @Test
    void testRefreshFailureIsReportedNotThrown() throws Exception {
        orchestrator.trackEvent("evt-1");
        odds.failWith(new UpstreamHttpException("the-odds-api", 500, "HTTP request failed with status 500"));

        orchestrator.refreshAllData().get(5, TimeUnit.SECONDS);

        PipelineEvent.Lifecycle failed = (PipelineEvent.Lifecycle) single(PipelineTopics.REFRESH_FAILED);
        assertInstanceOf(UpstreamHttpException.class, failed.failure());
        assertTrue(ofTopic(PipelineTopics.REFRESH_COMPLETED).isEmpty());
    }

    @Test
    void testBackgroundFailureBecomesErrorEvent() throws Exception {
        tearDown();
        orchestrator = build(fastSettings(Duration.ofMinutes(1)), Clock.systemUTC(), Map.of());
        odds.failWith(new UpstreamHttpException("the-odds-api", 503, "HTTP request failed with status 503"));
        CountDownLatch errorSeen = new CountDownLatch(2);
        orchestrator.subscribe(PipelineTopics.ERROR, event -> {
            PipelineEvent.PipelineError error = (PipelineEvent.PipelineError) event;
            if ("live_odds_fetch".equals(error.type()) && "evt-9".equals(error.context())) {
                errorSeen.countDown();
            }
        });
        orchestrator.trackEvent("evt-9");

        orchestrator.start();

        // a second error proves the schedule survived the first
        assertTrue(errorSeen.await(5, TimeUnit.SECONDS));
    }

    @Test
    void testShutdownStopsBackgroundFetchesAndEmptiesCache() throws Exception {
        tearDown();
        orchestrator = build(fastSettings(Duration.ofMillis(1)), Clock.systemUTC(), Map.of());
        stats.setStatus("g1", GameStatus.LIVE);
        orchestrator.trackLiveGame("g1");
        orchestrator.trackEvent("evt-1");
        orchestrator.start();
        awaitUntil(() -> stats.fetchCount() >= 2 && odds.fetchCount() >= 2);

        orchestrator.shutdown();
        int gameFetches = stats.fetchCount();
        int oddsFetches = odds.fetchCount();
        Thread.sleep(300);

        assertEquals(gameFetches, stats.fetchCount());
        assertEquals(oddsFetches, odds.fetchCount());
        assertEquals(0, cache.size());
        assertTrue(orchestrator.getConnectionStatus().isEmpty());
        assertEquals(1, ofTopic(PipelineTopics.SHUTDOWN).size());
        assertEquals(List.of(PipelineTopics.CACHE_CLEARED, PipelineTopics.SHUTDOWN), lastTopics(2));

        GameData game = orchestrator.getGameData("g1").get(5, TimeUnit.SECONDS);
        assertEquals("g1", game.id());
        assertEquals(gameFetches + 1, stats.fetchCount());
    }

    @Test
    void testUnsubscribe() {
        List<PipelineEvent> seen = new ArrayList<>();
        orchestrator.subscribe(PipelineTopics.CACHE_CLEARED, seen::add).cancel();

        orchestrator.clearCache();

        assertTrue(seen.isEmpty());
    }

    private PipelineOrchestrator build(PipelineSettings settings, Clock clock, Map<String, RateLimitRule> rules) {
        cache = new DataCache<>(100, clock);
        orchestratorRateLimiter = new RateLimiter(rules, clock);
        queue = new RequestQueue(Duration.ZERO);
        events = new EventBus<>("pipeline");
        oddsBus = new EventBus<>("odds");
        taskScheduler = new ThreadPoolTaskScheduler();
        taskScheduler.setPoolSize(3);
        taskScheduler.initialize();
        tracker = new ActiveEntityTracker();
        published.clear();

        for (String topic : List.of(PipelineTopics.DATA_UPDATED, PipelineTopics.ERROR,
            PipelineTopics.CONNECTION_ESTABLISHED, PipelineTopics.CONNECTION_FAILED, PipelineTopics.CACHE_CLEARED,
            PipelineTopics.REFRESH_STARTED, PipelineTopics.REFRESH_COMPLETED, PipelineTopics.REFRESH_FAILED,
            PipelineTopics.SHUTDOWN)) {
            events.subscribe(topic, event -> published.add(new Published(topic, event)));
        }

        return new PipelineOrchestrator(cache, orchestratorRateLimiter, queue, events, oddsBus,
            new RefreshScheduler(taskScheduler), tracker, stats, odds, projections, injuries, weather,
            settings, clock);
    }

    private static PipelineSettings fastSettings(Duration ttl) {
        Duration interval = Duration.ofMillis(20);
        return new PipelineSettings(
            new PipelineSettings.Ttls(ttl, ttl, ttl, ttl, ttl, ttl),
            new PipelineSettings.Intervals(interval, interval, Duration.ofHours(1)),
            PipelineSettings.Features.allEnabled(),
            List.of("nba"),
            Duration.ofSeconds(5));
    }

    private List<PipelineEvent> ofTopic(String topic) {
        synchronized (published) {
            return published.stream().filter(p -> p.topic().equals(topic)).map(Published::event).toList();
        }
    }

    private List<String> lastTopics(int count) {
        synchronized (published) {
            return published.subList(published.size() - count, published.size()).stream()
                .map(Published::topic).toList();
        }
    }

    private PipelineEvent single(String topic) {
        List<PipelineEvent> matching = ofTopic(topic);
        assertEquals(1, matching.size(), "events on " + topic);
        return matching.get(0);
    }

    private static void awaitUntil(java.util.function.BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("condition not met in time");
            }
            Thread.sleep(5);
        }
    }

    private record Published(String topic, PipelineEvent event) {}
}

package com.sportsdata.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sportsdata.application.cache.DataCache;
import com.sportsdata.application.event.EventBus;
import com.sportsdata.application.event.OddsUpdate;
import com.sportsdata.application.event.PipelineEvent;
import com.sportsdata.application.pipeline.ActiveEntityTracker;
import com.sportsdata.application.pipeline.PipelineOrchestrator;
import com.sportsdata.application.pipeline.PipelineSettings;
import com.sportsdata.application.pipeline.RefreshScheduler;
import com.sportsdata.application.queue.RequestQueue;
import com.sportsdata.application.ratelimit.RateLimitRule;
import com.sportsdata.application.ratelimit.RateLimiter;
import com.sportsdata.infrastructure.provider.UpstreamEndpoint;
import com.sportsdata.infrastructure.provider.UpstreamHttpClient;
import com.sportsdata.infrastructure.provider.injury.InjuryApiGateway;
import com.sportsdata.infrastructure.provider.oddsapi.TheOddsApiGateway;
import com.sportsdata.infrastructure.provider.prizepicks.PrizePicksGateway;
import com.sportsdata.infrastructure.provider.sportradar.SportradarGateway;
import com.sportsdata.infrastructure.provider.weather.WeatherApiGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wires the pipeline components and the provider gateways.
 */
@Configuration
@EnableConfigurationProperties(PipelineProperties.class)
public class PipelineConfig {

    private static final Logger logger = LoggerFactory.getLogger(PipelineConfig.class);

    public static final String SPORTRADAR = "sportradar";
    public static final String THE_ODDS_API = "the-odds-api";
    public static final String PRIZEPICKS = "prizepicks";
    public static final String INJURY_API = "injury-api";
    public static final String WEATHER = "weather";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public DataCache<String, Object> pipelineCache(PipelineProperties properties, Clock clock) {
        return new DataCache<>(properties.getCache().getMaxSize(), clock);
    }

    @Bean
    public RateLimiter rateLimiter(PipelineProperties properties, Clock clock) {
        Map<String, RateLimitRule> rules = new LinkedHashMap<>();
        properties.getEndpoints().forEach((id, endpoint) -> {
            PipelineProperties.RateLimit limit = endpoint.getRateLimit();
            rules.put(id, new RateLimitRule(limit.getRequests(), limit.getPeriod()));
            logger.info("Rate limit for {}: {} requests per {}s", id, limit.getRequests(), limit.getPeriod().toSeconds());
        });
        return new RateLimiter(rules, clock);
    }

    @Bean
    public RequestQueue requestQueue(PipelineProperties properties) {
        return new RequestQueue(properties.getQueue().getPacing());
    }

    @Bean
    public EventBus<PipelineEvent> pipelineEvents() {
        return new EventBus<>("pipeline");
    }

    @Bean
    public EventBus<OddsUpdate> oddsEvents() {
        return new EventBus<>("odds");
    }

    @Bean
    public ThreadPoolTaskScheduler refreshTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        // one thread per background job
        scheduler.setPoolSize(3);
        scheduler.setThreadNamePrefix("pipeline-refresh-");
        scheduler.setDaemon(true);
        return scheduler;
    }

    @Bean
    public RefreshScheduler refreshScheduler(ThreadPoolTaskScheduler refreshTaskScheduler) {
        return new RefreshScheduler(refreshTaskScheduler);
    }

    @Bean
    public ActiveEntityTracker activeEntityTracker() {
        return new ActiveEntityTracker();
    }

    @Bean
    public UpstreamHttpClient upstreamHttpClient(ObjectMapper objectMapper) {
        return new UpstreamHttpClient(objectMapper);
    }

    @Bean
    public SportradarGateway sportradarGateway(PipelineProperties properties, UpstreamHttpClient httpClient) {
        return new SportradarGateway(endpoint(properties, SPORTRADAR), httpClient);
    }

    @Bean
    public TheOddsApiGateway theOddsApiGateway(PipelineProperties properties, UpstreamHttpClient httpClient, Clock clock) {
        PipelineProperties.Odds odds = properties.getOdds();
        return new TheOddsApiGateway(endpoint(properties, THE_ODDS_API), httpClient,
            odds.getSportKey(), odds.getRegions(), odds.getOddsFormat(), clock);
    }

    @Bean
    public PrizePicksGateway prizePicksGateway(PipelineProperties properties, UpstreamHttpClient httpClient) {
        return new PrizePicksGateway(endpoint(properties, PRIZEPICKS), httpClient);
    }

    @Bean
    public InjuryApiGateway injuryApiGateway(PipelineProperties properties, UpstreamHttpClient httpClient) {
        return new InjuryApiGateway(endpoint(properties, INJURY_API), httpClient);
    }

    @Bean
    public WeatherApiGateway weatherApiGateway(PipelineProperties properties, UpstreamHttpClient httpClient) {
        return new WeatherApiGateway(endpoint(properties, WEATHER), httpClient);
    }

    @Bean(initMethod = "start", destroyMethod = "shutdown")
    public PipelineOrchestrator pipelineOrchestrator(
        DataCache<String, Object> pipelineCache,
        RateLimiter rateLimiter,
        RequestQueue requestQueue,
        EventBus<PipelineEvent> pipelineEvents,
        EventBus<OddsUpdate> oddsEvents,
        RefreshScheduler refreshScheduler,
        ActiveEntityTracker activeEntityTracker,
        SportradarGateway sportradarGateway,
        TheOddsApiGateway theOddsApiGateway,
        PrizePicksGateway prizePicksGateway,
        InjuryApiGateway injuryApiGateway,
        WeatherApiGateway weatherApiGateway,
        PipelineProperties properties,
        Clock clock
    ) {
        return new PipelineOrchestrator(
            pipelineCache, rateLimiter, requestQueue, pipelineEvents, oddsEvents,
            refreshScheduler, activeEntityTracker,
            sportradarGateway, theOddsApiGateway, prizePicksGateway, injuryApiGateway, weatherApiGateway,
            settings(properties), clock);
    }

    static PipelineSettings settings(PipelineProperties properties) {
        PipelineProperties.Ttl ttl = properties.getCache().getTtl();
        PipelineProperties.Schedule schedule = properties.getSchedule();
        PipelineProperties.Features features = properties.getFeatures();
        return new PipelineSettings(
            new PipelineSettings.Ttls(ttl.getGame(), ttl.getPlayer(), ttl.getOdds(),
                ttl.getProjections(), ttl.getInjuries(), ttl.getWeather()),
            new PipelineSettings.Intervals(schedule.getOddsInterval(), schedule.getLiveGamesInterval(),
                schedule.getInjuriesInterval()),
            new PipelineSettings.Features(features.isRealTimeOdds(), features.isLiveGames(),
                features.isInjuryTracking(), features.isWeatherIntegration()),
            properties.getSports(),
            properties.getQueue().getShutdownDrainTimeout()
        );
    }

    static UpstreamEndpoint endpoint(PipelineProperties properties, String sourceId) {
        PipelineProperties.Endpoint endpoint = properties.getEndpoints().get(sourceId);
        if (endpoint == null) {
            logger.warn("No endpoint configured for {}, source will be reported unavailable", sourceId);
            endpoint = new PipelineProperties.Endpoint();
        }
        return new UpstreamEndpoint(sourceId, endpoint.getBaseUrl(), endpoint.getVersion(), endpoint.getApiKey(),
            endpoint.getTimeout(), endpoint.isRequiresApiKey());
    }
}

package com.sportsdata.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pipeline settings bound from the {@code pipeline.*} namespace.
 */
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    private Cache cache = new Cache();
    private Queue queue = new Queue();
    private Schedule schedule = new Schedule();
    private Features features = new Features();
    private Odds odds = new Odds();

    /**
     * Sport keys whose injury reports are refreshed.
     */
    private List<String> sports = new ArrayList<>(List.of("nba", "wnba", "mlb", "epl", "nfl", "ncaab"));

    /**
     * Upstream providers keyed by source id (sportradar, the-odds-api, prizepicks, injury-api, weather).
     */
    private Map<String, Endpoint> endpoints = new LinkedHashMap<>();

    public Cache getCache() {
        return cache;
    }

    public void setCache(Cache cache) {
        this.cache = cache;
    }

    public Queue getQueue() {
        return queue;
    }

    public void setQueue(Queue queue) {
        this.queue = queue;
    }

    public Schedule getSchedule() {
        return schedule;
    }

    public void setSchedule(Schedule schedule) {
        this.schedule = schedule;
    }

    public Features getFeatures() {
        return features;
    }

    public void setFeatures(Features features) {
        this.features = features;
    }

    public Odds getOdds() {
        return odds;
    }

    public void setOdds(Odds odds) {
        this.odds = odds;
    }

    public List<String> getSports() {
        return sports;
    }

    public void setSports(List<String> sports) {
        this.sports = sports;
    }

    public Map<String, Endpoint> getEndpoints() {
        return endpoints;
    }

    public void setEndpoints(Map<String, Endpoint> endpoints) {
        this.endpoints = endpoints;
    }

    public static class Cache {

        private int maxSize = 1000;
        private Ttl ttl = new Ttl();

        public int getMaxSize() {
            return maxSize;
        }

        public void setMaxSize(int maxSize) {
            this.maxSize = maxSize;
        }

        public Ttl getTtl() {
            return ttl;
        }

        public void setTtl(Ttl ttl) {
            this.ttl = ttl;
        }
    }

    public static class Ttl {

        private Duration game = Duration.ofHours(1);
        private Duration player = Duration.ofMinutes(5);
        private Duration odds = Duration.ofSeconds(30);
        private Duration projections = Duration.ofMinutes(5);
        private Duration injuries = Duration.ofMinutes(30);
        private Duration weather = Duration.ofMinutes(30);

        public Duration getGame() {
            return game;
        }

        public void setGame(Duration game) {
            this.game = game;
        }

        public Duration getPlayer() {
            return player;
        }

        public void setPlayer(Duration player) {
            this.player = player;
        }

        public Duration getOdds() {
            return odds;
        }

        public void setOdds(Duration odds) {
            this.odds = odds;
        }

        public Duration getProjections() {
            return projections;
        }

        public void setProjections(Duration projections) {
            this.projections = projections;
        }

        public Duration getInjuries() {
            return injuries;
        }

        public void setInjuries(Duration injuries) {
            this.injuries = injuries;
        }

        public Duration getWeather() {
            return weather;
        }

        public void setWeather(Duration weather) {
            this.weather = weather;
        }
    }

    public static class Queue {

        /**
         * Pause after every upstream call.
         */
        private Duration pacing = Duration.ofMillis(100);

        /**
         * How long shutdown waits for enqueued reads.
         */
        private Duration shutdownDrainTimeout = Duration.ofSeconds(5);

        public Duration getPacing() {
            return pacing;
        }

        public void setPacing(Duration pacing) {
            this.pacing = pacing;
        }

        public Duration getShutdownDrainTimeout() {
            return shutdownDrainTimeout;
        }

        public void setShutdownDrainTimeout(Duration shutdownDrainTimeout) {
            this.shutdownDrainTimeout = shutdownDrainTimeout;
        }
    }

    public static class Schedule {

        private Duration oddsInterval = Duration.ofSeconds(30);
        private Duration liveGamesInterval = Duration.ofSeconds(15);
        private Duration injuriesInterval = Duration.ofMinutes(30);

        public Duration getOddsInterval() {
            return oddsInterval;
        }

        public void setOddsInterval(Duration oddsInterval) {
            this.oddsInterval = oddsInterval;
        }

        public Duration getLiveGamesInterval() {
            return liveGamesInterval;
        }

        public void setLiveGamesInterval(Duration liveGamesInterval) {
            this.liveGamesInterval = liveGamesInterval;
        }

        public Duration getInjuriesInterval() {
            return injuriesInterval;
        }

        public void setInjuriesInterval(Duration injuriesInterval) {
            this.injuriesInterval = injuriesInterval;
        }
    }

    public static class Features {

        private boolean realTimeOdds = true;
        private boolean liveGames = true;
        private boolean injuryTracking = true;
        private boolean weatherIntegration = true;

        public boolean isRealTimeOdds() {
            return realTimeOdds;
        }

        public void setRealTimeOdds(boolean realTimeOdds) {
            this.realTimeOdds = realTimeOdds;
        }

        public boolean isLiveGames() {
            return liveGames;
        }

        public void setLiveGames(boolean liveGames) {
            this.liveGames = liveGames;
        }

        public boolean isInjuryTracking() {
            return injuryTracking;
        }

        public void setInjuryTracking(boolean injuryTracking) {
            this.injuryTracking = injuryTracking;
        }

        public boolean isWeatherIntegration() {
            return weatherIntegration;
        }

        public void setWeatherIntegration(boolean weatherIntegration) {
            this.weatherIntegration = weatherIntegration;
        }
    }

    public static class Odds {

        private String sportKey = "americanfootball_nfl";
        private String regions = "us";
        private String oddsFormat = "american";

        public String getSportKey() {
            return sportKey;
        }

        public void setSportKey(String sportKey) {
            this.sportKey = sportKey;
        }

        public String getRegions() {
            return regions;
        }

        public void setRegions(String regions) {
            this.regions = regions;
        }

        public String getOddsFormat() {
            return oddsFormat;
        }

        public void setOddsFormat(String oddsFormat) {
            this.oddsFormat = oddsFormat;
        }
    }

    public static class Endpoint {

        private String baseUrl;
        private String apiKey;
        private String version;
        private Duration timeout = Duration.ofSeconds(10);
        private boolean requiresApiKey = true;
        private RateLimit rateLimit = new RateLimit();

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getVersion() {
            return version;
        }

        public void setVersion(String version) {
            this.version = version;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public boolean isRequiresApiKey() {
            return requiresApiKey;
        }

        public void setRequiresApiKey(boolean requiresApiKey) {
            this.requiresApiKey = requiresApiKey;
        }

        public RateLimit getRateLimit() {
            return rateLimit;
        }

        public void setRateLimit(RateLimit rateLimit) {
            this.rateLimit = rateLimit;
        }
    }

    public static class RateLimit {

        private int requests = 100;
        private Duration period = Duration.ofSeconds(60);

        public int getRequests() {
            return requests;
        }

        public void setRequests(int requests) {
            this.requests = requests;
        }

        public Duration getPeriod() {
            return period;
        }

        public void setPeriod(Duration period) {
            this.period = period;
        }
    }
}

package com.sportsdata.infrastructure.provider.weather;

import com.sportsdata.domain.model.WeatherData;
import com.sportsdata.domain.ports.WeatherGateway;
import com.sportsdata.infrastructure.provider.HttpUpstreamGateway;
import com.sportsdata.infrastructure.provider.UpstreamEndpoint;
import com.sportsdata.infrastructure.provider.UpstreamHttpClient;
import com.sportsdata.infrastructure.provider.payload.WeatherApiPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Current conditions from WeatherAPI, queried by venue id or location.
 */
public class WeatherApiGateway extends HttpUpstreamGateway implements WeatherGateway {

    private static final Logger logger = LoggerFactory.getLogger(WeatherApiGateway.class);

    public WeatherApiGateway(UpstreamEndpoint endpoint, UpstreamHttpClient httpClient) {
        super(endpoint, httpClient);
    }

    @Override
    protected String apiKeyParam() {
        return "key";
    }

    @Override
    public WeatherData fetchWeather(String venueId) {
        logger.debug("Fetching weather for {}", venueId);
        WeatherApiPayload payload = get("/current.json", Map.of("q", venueId), WeatherApiPayload.class);
        return WeatherMapper.toWeather(payload);
    }
}

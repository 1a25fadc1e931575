package com.sportsdata.domain.ports;

import com.sportsdata.domain.model.WeatherData;

/**
 * Port for venue weather.
 */
public interface WeatherGateway extends UpstreamSource {

    /**
     * @param venueId venue id or location query understood by the provider
     * @return current conditions
     */
    WeatherData fetchWeather(String venueId);
}

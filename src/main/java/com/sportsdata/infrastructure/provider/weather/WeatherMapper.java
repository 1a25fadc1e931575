package com.sportsdata.infrastructure.provider.weather;

import com.sportsdata.domain.exception.TransformException;
import com.sportsdata.domain.model.WeatherData;
import com.sportsdata.infrastructure.provider.payload.WeatherApiPayload;

/**
 * Maps the WeatherAPI current-conditions block to {@link WeatherData}.
 */
public class WeatherMapper {

    static final String SOURCE = "weather";

    private WeatherMapper() {
    }

    public static WeatherData toWeather(WeatherApiPayload payload) {
        WeatherApiPayload.Current current = payload.current();
        if (current == null) {
            throw new TransformException(SOURCE, "Weather payload has no current block");
        }
        return new WeatherData(
            orZero(current.tempF()),
            orZero(current.humidity()),
            orZero(current.windMph()),
            orZero(current.windDegree()),
            orZero(current.precipIn()),
            orZero(current.visMiles()),
            current.condition() != null && current.condition().text() != null ? current.condition().text() : "unknown"
        );
    }

    private static double orZero(Double value) {
        return value != null ? value : 0.0;
    }
}

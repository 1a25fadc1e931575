package com.sportsdata.infrastructure.provider.weather;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sportsdata.domain.exception.TransformException;
import com.sportsdata.domain.model.WeatherData;
import com.sportsdata.infrastructure.provider.payload.WeatherApiPayload;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WeatherMapperTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void testMapsCurrentConditions() throws Exception {
        String json = """
            {
              "location": {"name": "Green Bay", "region": "Wisconsin", "country": "USA"},
              "current": {"temp_f": 28.4, "humidity": 71, "wind_mph": 12.5, "wind_degree": 290,
                          "precip_in": 0.02, "vis_miles": 6.0, "condition": {"text": "Light snow", "code": 1213}}
            }
            """;

        WeatherData weather = WeatherMapper.toWeather(objectMapper.readValue(json, WeatherApiPayload.class));

        assertEquals(28.4, weather.temperature());
        assertEquals(71.0, weather.humidity());
        assertEquals(12.5, weather.windSpeed());
        assertEquals(290.0, weather.windDirection());
        assertEquals(0.02, weather.precipitation());
        assertEquals(6.0, weather.visibility());
        assertEquals("Light snow", weather.conditions());
    }

    @Test
    void testMissingCurrentBlockIsRejected() throws Exception {
        WeatherApiPayload payload = objectMapper.readValue("{\"location\": {\"name\": \"Nowhere\"}}", WeatherApiPayload.class);

        TransformException e = assertThrows(TransformException.class, () -> WeatherMapper.toWeather(payload));
        assertEquals("weather", e.getSource());
    }
}

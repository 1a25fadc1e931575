package com.sportsdata.infrastructure.provider.oddsapi;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sportsdata.domain.model.OddsData;
import com.sportsdata.infrastructure.provider.payload.OddsApiEventPayload;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OddsApiMapperTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());

    @Test
    void testFlattensBookmakersAndMarkets() throws Exception {
        String json = """
            {
              "id": "evt-1",
              "sport_key": "basketball_nba",
              "commence_time": "2024-03-02T00:30:00Z",
              "home_team": "Los Angeles Lakers",
              "away_team": "Boston Celtics",
              "bookmakers": [
                {
                  "key": "draftkings",
                  "title": "DraftKings",
                  "last_update": "2024-03-01T11:59:00Z",
                  "markets": [
                    {"key": "h2h", "last_update": "2024-03-01T11:58:00Z", "outcomes": [
                      {"name": "Los Angeles Lakers", "price": 150},
                      {"name": "Boston Celtics", "price": -180}
                    ]},
                    {"key": "totals", "outcomes": [
                      {"name": "Over", "price": -110, "point": 228.5},
                      {"name": "Under", "price": -110, "point": 228.5}
                    ]}
                  ]
                },
                {"key": "fanduel", "title": "FanDuel", "markets": [
                  {"key": "h2h", "outcomes": [{"name": "Los Angeles Lakers", "price": 145}]}
                ]}
              ]
            }
            """;

        List<OddsData> odds = OddsApiMapper.toOdds(objectMapper.readValue(json, OddsApiEventPayload.class), "evt-1", NOW);

        assertEquals(3, odds.size());
        OddsData draftkingsH2h = odds.get(0);
        assertEquals("draftkings", draftkingsH2h.bookmaker());
        assertEquals("h2h", draftkingsH2h.market());
        assertEquals(Instant.parse("2024-03-01T11:58:00Z"), draftkingsH2h.timestamp());
        assertEquals(new BigDecimal("150"), draftkingsH2h.outcomes().get(0).price());
        assertNull(draftkingsH2h.outcomes().get(0).point());

        OddsData totals = odds.get(1);
        assertEquals(Instant.parse("2024-03-01T11:59:00Z"), totals.timestamp(), "falls back to bookmaker update");
        assertEquals(new BigDecimal("228.5"), totals.outcomes().get(0).point());

        assertEquals(NOW, odds.get(2).timestamp(), "falls back to capture time");
    }

    @Test
    void testEventWithoutBookmakers() throws Exception {
        List<OddsData> odds = OddsApiMapper.toOdds(
            objectMapper.readValue("{\"id\": \"evt-2\"}", OddsApiEventPayload.class), "evt-2", NOW);

        assertTrue(odds.isEmpty());
    }
}

package com.sportsdata.infrastructure.provider.sportradar;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sportsdata.domain.exception.TransformException;
import com.sportsdata.domain.model.GameData;
import com.sportsdata.domain.model.GameStatus;
import com.sportsdata.domain.model.PlayerData;
import com.sportsdata.domain.model.TeamData;
import com.sportsdata.infrastructure.provider.payload.SportradarGamePayload;
import com.sportsdata.infrastructure.provider.payload.SportradarPlayerPayload;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class SportradarMapperTest {

    private final ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());

    @Test
    void testMapsGame() throws Exception {
        String json = """
            {
              "id": "g-100",
              "sport": "basketball",
              "league": {"id": "nba", "name": "NBA"},
              "status": "inprogress",
              "scheduled": "2024-03-01T00:30:00+00:00",
              "home_team": {"id": "lal", "name": "Lakers", "alias": "LAL", "market": "Los Angeles", "wins": 40, "losses": 30},
              "away_team": {"id": "bos", "name": "Celtics", "alias": "BOS", "market": "Boston", "wins": 55, "losses": 15},
              "venue": {"id": "v1", "name": "Crypto.com Arena", "city": "Los Angeles", "state": "CA", "capacity": 19068},
              "coverage": "full"
            }
            """;

        GameData game = SportradarMapper.toGame(objectMapper.readValue(json, SportradarGamePayload.class));

        assertEquals("g-100", game.id());
        assertEquals("NBA", game.league());
        assertEquals(GameStatus.LIVE, game.status());
        assertEquals(Instant.parse("2024-03-01T00:30:00Z"), game.startTime());
        assertEquals("Los Angeles", game.homeTeam().city());
        assertEquals(40, game.homeTeam().record().wins());
        assertEquals(0, game.homeTeam().record().ties());
        assertEquals(TeamData.DEFAULT_ELO, game.awayTeam().eloRating());
        assertEquals(19068, game.venue().capacity());
    }

    @Test
    void testGameDefaults() throws Exception {
        String json = """
            {"id": "g-1", "home_team": {"id": "a", "name": "A"}, "away_team": {"id": "b", "name": "B"}}
            """;

        GameData game = SportradarMapper.toGame(objectMapper.readValue(json, SportradarGamePayload.class));

        assertEquals("unknown", game.sport());
        assertEquals("unknown", game.league());
        assertEquals(GameStatus.SCHEDULED, game.status());
        assertNull(game.startTime());
        assertNull(game.venue());
        assertEquals("", game.homeTeam().city());
    }

    @Test
    void testGameWithoutTeamIsRejected() {
        SportradarGamePayload payload = new SportradarGamePayload("g-1", null, null, null, null, null, null, null);

        TransformException e = assertThrows(TransformException.class, () -> SportradarMapper.toGame(payload));
        assertEquals("sportradar", e.getSource());
    }

    @Test
    void testGameWithoutIdIsRejected() {
        SportradarGamePayload payload = new SportradarGamePayload(null, null, null, null, null, null, null, null);

        assertThrows(TransformException.class, () -> SportradarMapper.toGame(payload));
    }

    @Test
    void testMapsPlayer() throws Exception {
        String json = """
            {
              "id": "p-23",
              "full_name": "LeBron James",
              "position": "F",
              "jersey_number": "23",
              "team": {"id": "lal", "name": "Lakers"},
              "statistics": {
                "games_played": 60,
                "averages": {"points": 25.4, "rebounds": 7.2},
                "per_36": {"points": 26.1},
                "totals": {"points": 1524}
              }
            }
            """;

        PlayerData player = SportradarMapper.toPlayer(objectMapper.readValue(json, SportradarPlayerPayload.class));

        assertEquals("LeBron James", player.name());
        assertEquals(23, player.jersey());
        assertEquals("lal", player.teamId());
        assertEquals(60, player.stats().gamesPlayed());
        assertEquals(25.4, player.stats().averages().get("points"));
        assertEquals(1524.0, player.stats().seasonTotals().get("points"));
        assertTrue(player.stats().advanced().isEmpty());
    }

    @Test
    void testPlayerWithoutStatistics() throws Exception {
        PlayerData player = SportradarMapper.toPlayer(
            objectMapper.readValue("{\"id\": \"p-1\", \"name\": \"Rookie\"}", SportradarPlayerPayload.class));

        assertEquals("Rookie", player.name());
        assertEquals(0, player.jersey());
        assertEquals("", player.teamId());
        assertEquals(0, player.stats().gamesPlayed());
    }

    @Test
    void testPlayerWithoutNameIsRejected() throws Exception {
        SportradarPlayerPayload payload = objectMapper.readValue("{\"id\": \"p-1\"}", SportradarPlayerPayload.class);

        assertThrows(TransformException.class, () -> SportradarMapper.toPlayer(payload));
    }
}

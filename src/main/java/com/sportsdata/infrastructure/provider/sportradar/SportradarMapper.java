package com.sportsdata.infrastructure.provider.sportradar;

import com.sportsdata.domain.exception.TransformException;
import com.sportsdata.domain.model.GameData;
import com.sportsdata.domain.model.GameStatus;
import com.sportsdata.domain.model.PlayerData;
import com.sportsdata.domain.model.PlayerStats;
import com.sportsdata.domain.model.TeamData;
import com.sportsdata.domain.model.TeamRecord;
import com.sportsdata.domain.model.VenueData;
import com.sportsdata.infrastructure.provider.payload.SportradarGamePayload;
import com.sportsdata.infrastructure.provider.payload.SportradarPlayerPayload;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;

/**
 * Maps Sportradar games and players to canonical types.
 */
public class SportradarMapper {

    static final String SOURCE = "sportradar";
    private static final String UNKNOWN = "unknown";

    private SportradarMapper() {
    }

    public static GameData toGame(SportradarGamePayload payload) {
        if (isBlank(payload.id())) {
            throw new TransformException(SOURCE, "Game payload has no id");
        }
        return new GameData(
            payload.id(),
            orDefault(payload.sport(), UNKNOWN),
            payload.league() != null ? orDefault(payload.league().name(), UNKNOWN) : UNKNOWN,
            toTeam(payload.homeTeam(), "home"),
            toTeam(payload.awayTeam(), "away"),
            parseScheduled(payload.scheduled()),
            GameStatus.fromProvider(payload.status()),
            payload.venue() != null ? toVenue(payload.venue()) : null
        );
    }

    public static PlayerData toPlayer(SportradarPlayerPayload payload) {
        if (isBlank(payload.id())) {
            throw new TransformException(SOURCE, "Player payload has no id");
        }
        String name = !isBlank(payload.fullName()) ? payload.fullName() : payload.name();
        if (isBlank(name)) {
            throw new TransformException(SOURCE, "Player " + payload.id() + " has no name");
        }

        Integer jersey = payload.jerseyNumber() != null ? payload.jerseyNumber() : payload.jersey();
        return new PlayerData(
            payload.id(),
            name,
            orDefault(payload.position(), ""),
            payload.team() != null ? orDefault(payload.team().id(), "") : "",
            jersey != null ? jersey : 0,
            toStats(payload.statistics())
        );
    }

    private static TeamData toTeam(SportradarGamePayload.Team team, String side) {
        if (team == null || isBlank(team.id()) || isBlank(team.name())) {
            throw new TransformException(SOURCE, "Game payload has an incomplete " + side + " team");
        }
        TeamRecord record = new TeamRecord(
            orZero(team.wins()),
            orZero(team.losses()),
            orZero(team.ties())
        );
        return new TeamData(team.id(), team.name(), orDefault(team.alias(), ""),
            orDefault(team.market(), ""), record, TeamData.DEFAULT_ELO);
    }

    private static VenueData toVenue(SportradarGamePayload.Venue venue) {
        return new VenueData(
            orDefault(venue.id(), ""),
            orDefault(venue.name(), ""),
            orDefault(venue.city(), ""),
            orDefault(venue.state(), ""),
            orZero(venue.capacity())
        );
    }

    private static PlayerStats toStats(SportradarPlayerPayload.Statistics statistics) {
        if (statistics == null) {
            return PlayerStats.empty();
        }
        return new PlayerStats(
            orZero(statistics.gamesPlayed()),
            statistics.averages(),
            statistics.per36(),
            statistics.advanced(),
            statistics.totals()
        );
    }

    private static Instant parseScheduled(String scheduled) {
        if (isBlank(scheduled)) {
            return null;
        }
        try {
            return OffsetDateTime.parse(scheduled).toInstant();
        } catch (DateTimeParseException e) {
            throw new TransformException(SOURCE, "Unparseable scheduled time: " + scheduled, e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String orDefault(String value, String fallback) {
        return isBlank(value) ? fallback : value;
    }

    private static int orZero(Integer value) {
        return value != null ? value : 0;
    }
}

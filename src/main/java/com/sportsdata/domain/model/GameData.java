package com.sportsdata.domain.model;

import java.time.Instant;

/**
 * Canonical game representation produced from the stats provider.
 *
 * @param id        provider game id
 * @param sport     sport name, "unknown" when not reported
 * @param league    league name, "unknown" when not reported
 * @param homeTeam  home side
 * @param awayTeam  away side
 * @param startTime scheduled start, may be null when the provider omits it
 * @param status    current status
 * @param venue     venue, null when not reported
 */
public record GameData(
    String id,
    String sport,
    String league,
    TeamData homeTeam,
    TeamData awayTeam,
    Instant startTime,
    GameStatus status,
    VenueData venue
) {

    public boolean isLive() {
        return status == GameStatus.LIVE;
    }
}

package com.sportsdata.domain.ports;

import com.sportsdata.domain.model.GameData;
import com.sportsdata.domain.model.PlayerData;

/**
 * Port for game and player statistics.
 */
public interface SportsStatsGateway extends UpstreamSource {

    /**
     * Fetches a single game.
     *
     * @param gameId provider game id
     * @return the canonical game
     */
    GameData fetchGame(String gameId);

    /**
     * Fetches a single player profile with statistics.
     *
     * @param playerId provider player id
     * @return the canonical player
     */
    PlayerData fetchPlayer(String playerId);
}

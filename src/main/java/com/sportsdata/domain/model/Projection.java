package com.sportsdata.domain.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Daily-fantasy player projection (over/under line for one stat).
 *
 * @param id         provider projection id
 * @param playerId   provider player id
 * @param playerName player name, empty when the player was not included in the response
 * @param team       team name, may be empty
 * @param league     league id as reported by the provider, may be empty
 * @param statType   projected stat, e.g. "Points"
 * @param line       projected line
 * @param startTime  game start, may be null
 * @param status     projection status, e.g. "pre_game"
 */
public record Projection(
    String id,
    String playerId,
    String playerName,
    String team,
    String league,
    String statType,
    BigDecimal line,
    Instant startTime,
    String status
) {}

package com.sportsdata.domain.model;

/**
 * Injury report entry for one player.
 *
 * @param playerId       provider player id
 * @param type           injury description, e.g. "Ankle"
 * @param severity       severity bucket
 * @param status         availability status
 * @param expectedReturn expected return as reported (free text date), may be null
 * @param impact         estimated impact on the player's output, 0-1 scale
 */
public record InjuryData(
    String playerId,
    String type,
    InjurySeverity severity,
    InjuryStatus status,
    String expectedReturn,
    double impact
) {

    public static final double DEFAULT_IMPACT = 0.1;
}

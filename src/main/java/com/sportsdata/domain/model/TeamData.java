package com.sportsdata.domain.model;

/**
 * Canonical team representation.
 *
 * @param id           provider team id
 * @param name         team name, e.g. "Lakers"
 * @param abbreviation short alias, e.g. "LAL"
 * @param city         market / city name, empty when the provider omits it
 * @param record       season record
 * @param eloRating    rating seed; providers do not report it, so it starts at {@link #DEFAULT_ELO}
 */
public record TeamData(
    String id,
    String name,
    String abbreviation,
    String city,
    TeamRecord record,
    int eloRating
) {

    public static final int DEFAULT_ELO = 1500;
}

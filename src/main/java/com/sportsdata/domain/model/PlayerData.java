package com.sportsdata.domain.model;

/**
 * Canonical player representation.
 *
 * @param id       provider player id
 * @param name     full name
 * @param position position code, empty when unknown
 * @param teamId   current team id, empty when unknown
 * @param jersey   jersey number, 0 when unknown
 * @param stats    statistical summary
 */
public record PlayerData(
    String id,
    String name,
    String position,
    String teamId,
    int jersey,
    PlayerStats stats
) {}

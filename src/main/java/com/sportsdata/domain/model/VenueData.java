package com.sportsdata.domain.model;

/**
 * Venue where a game is played.
 */
public record VenueData(
    String id,
    String name,
    String city,
    String state,
    int capacity
) {}

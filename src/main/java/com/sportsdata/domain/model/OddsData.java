package com.sportsdata.domain.model;

import java.time.Instant;
import java.util.List;

/**
 * Prices offered by one bookmaker for one market of an event.
 *
 * @param eventId   event id
 * @param bookmaker bookmaker key, e.g. "draftkings"
 * @param market    market key, e.g. "h2h", "spreads", "totals"
 * @param outcomes  priced outcomes
 * @param timestamp last update reported by the bookmaker, or capture time when absent
 */
public record OddsData(
    String eventId,
    String bookmaker,
    String market,
    List<OddsOutcome> outcomes,
    Instant timestamp
) {

    public OddsData {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }
}

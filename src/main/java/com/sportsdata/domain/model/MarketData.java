package com.sportsdata.domain.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Cross-bookmaker view of one market of an event, derived from the current odds snapshot.
 *
 * @param eventId        event id
 * @param market         market key
 * @param currentOdds    per-bookmaker odds for this market
 * @param bestPrices     best available outcome per outcome name
 * @param bookmakerCount number of bookmakers pricing the market
 * @param capturedAt     time the snapshot was assembled
 */
public record MarketData(
    String eventId,
    String market,
    List<OddsData> currentOdds,
    Map<String, OddsOutcome> bestPrices,
    int bookmakerCount,
    Instant capturedAt
) {

    public MarketData {
        currentOdds = List.copyOf(currentOdds);
        bestPrices = Map.copyOf(bestPrices);
    }
}

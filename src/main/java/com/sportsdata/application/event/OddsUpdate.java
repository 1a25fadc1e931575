package com.sportsdata.application.event;

import com.sportsdata.domain.model.OddsData;

import java.util.List;

/**
 * Fresh odds for an event, published on the narrow odds bus.
 *
 * @param market requested market key, or {@code all}
 */
public record OddsUpdate(String eventId, String market, List<OddsData> odds) {

    public OddsUpdate {
        odds = odds == null ? List.of() : List.copyOf(odds);
    }
}

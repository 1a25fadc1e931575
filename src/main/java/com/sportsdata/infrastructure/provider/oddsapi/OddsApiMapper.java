package com.sportsdata.infrastructure.provider.oddsapi;

import com.sportsdata.domain.exception.TransformException;
import com.sportsdata.domain.model.OddsData;
import com.sportsdata.domain.model.OddsOutcome;
import com.sportsdata.infrastructure.provider.payload.OddsApiEventPayload;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Flattens an Odds API event into one {@link OddsData} per bookmaker and market.
 */
public class OddsApiMapper {

    static final String SOURCE = "the-odds-api";

    private OddsApiMapper() {
    }

    /**
     * @param eventId    id the odds were requested for, used when the payload omits its own
     * @param capturedAt timestamp for markets without a reported update time
     */
    public static List<OddsData> toOdds(OddsApiEventPayload payload, String eventId, Instant capturedAt) {
        String id = payload.id() != null ? payload.id() : eventId;
        if (payload.bookmakers() == null) {
            return List.of();
        }

        List<OddsData> odds = new ArrayList<>();
        for (OddsApiEventPayload.Bookmaker bookmaker : payload.bookmakers()) {
            if (bookmaker.key() == null) {
                throw new TransformException(SOURCE, "Bookmaker without key in event " + id);
            }
            if (bookmaker.markets() == null) {
                continue;
            }
            for (OddsApiEventPayload.Market market : bookmaker.markets()) {
                Instant timestamp = market.lastUpdate() != null ? market.lastUpdate()
                    : bookmaker.lastUpdate() != null ? bookmaker.lastUpdate()
                    : capturedAt;
                odds.add(new OddsData(id, bookmaker.key(), market.key(), toOutcomes(market), timestamp));
            }
        }
        return odds;
    }

    private static List<OddsOutcome> toOutcomes(OddsApiEventPayload.Market market) {
        if (market.outcomes() == null) {
            return List.of();
        }
        return market.outcomes().stream()
            .map(o -> new OddsOutcome(o.name(), o.price(), o.point()))
            .toList();
    }
}

package com.sportsdata.application.pipeline;

import com.sportsdata.domain.model.MarketData;
import com.sportsdata.domain.model.OddsData;
import com.sportsdata.domain.model.OddsOutcome;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link MarketData} view from an odds snapshot.
 */
final class MarketAggregator {

    private MarketAggregator() {
    }

    /**
     * Keeps the odds of the requested market and picks the highest price per outcome name.
     * Higher is better for both decimal and american prices. For point markets the outcome
     * key includes the line, so different handicaps are not compared with each other.
     */
    static MarketData aggregate(String eventId, String market, List<OddsData> odds, Instant capturedAt) {
        List<OddsData> inMarket = odds.stream()
            .filter(o -> market == null || market.equals(o.market()))
            .toList();

        Map<String, OddsOutcome> best = new LinkedHashMap<>();
        for (OddsData data : inMarket) {
            for (OddsOutcome outcome : data.outcomes()) {
                if (outcome.price() == null) {
                    continue;
                }
                best.merge(outcomeKey(outcome), outcome,
                    (current, candidate) -> candidate.price().compareTo(current.price()) > 0 ? candidate : current);
            }
        }

        int bookmakers = (int) inMarket.stream().map(OddsData::bookmaker).distinct().count();
        return new MarketData(eventId, market, inMarket, best, bookmakers, capturedAt);
    }

    private static String outcomeKey(OddsOutcome outcome) {
        return outcome.point() == null
            ? outcome.name()
            : outcome.name() + " " + outcome.point().stripTrailingZeros().toPlainString();
    }
}

package com.sportsdata.domain.ports;

import com.sportsdata.domain.model.OddsData;

import java.util.List;

/**
 * Port for bookmaker odds.
 */
public interface OddsGateway extends UpstreamSource {

    /**
     * Fetches current odds of an event.
     *
     * @param eventId provider event id
     * @param market  market key to restrict to, or null for the provider default
     * @return one entry per bookmaker and market
     */
    List<OddsData> fetchOdds(String eventId, String market);
}

package com.sportsdata.domain.ports;

import com.sportsdata.domain.model.InjuryData;

import java.util.List;

/**
 * Port for injury reports.
 */
public interface InjuryGateway extends UpstreamSource {

    /**
     * @param sport sport key, lower case (e.g. "nba")
     * @return current injury report of the sport
     */
    List<InjuryData> fetchInjuries(String sport);
}

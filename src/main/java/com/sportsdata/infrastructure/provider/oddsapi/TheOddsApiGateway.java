package com.sportsdata.infrastructure.provider.oddsapi;

import com.sportsdata.domain.model.OddsData;
import com.sportsdata.domain.ports.OddsGateway;
import com.sportsdata.infrastructure.provider.HttpUpstreamGateway;
import com.sportsdata.infrastructure.provider.UpstreamEndpoint;
import com.sportsdata.infrastructure.provider.UpstreamHttpClient;
import com.sportsdata.infrastructure.provider.payload.OddsApiEventPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bookmaker odds from The Odds API.
 */
public class TheOddsApiGateway extends HttpUpstreamGateway implements OddsGateway {

    private static final Logger logger = LoggerFactory.getLogger(TheOddsApiGateway.class);

    private final String sportKey;
    private final String regions;
    private final String oddsFormat;
    private final Clock clock;

    public TheOddsApiGateway(
        UpstreamEndpoint endpoint,
        UpstreamHttpClient httpClient,
        String sportKey,
        String regions,
        String oddsFormat,
        Clock clock
    ) {
        super(endpoint, httpClient);
        this.sportKey = sportKey;
        this.regions = regions;
        this.oddsFormat = oddsFormat;
        this.clock = clock;
    }

    @Override
    protected String apiKeyParam() {
        return "apiKey";
    }

    @Override
    public List<OddsData> fetchOdds(String eventId, String market) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("regions", regions);
        params.put("oddsFormat", oddsFormat);
        if (market != null) {
            params.put("markets", market);
        }

        logger.debug("Fetching odds for event {} (markets={})", eventId, market);
        String path = "/sports/" + UpstreamHttpClient.pathSegment(sportKey)
            + "/events/" + UpstreamHttpClient.pathSegment(eventId) + "/odds";
        OddsApiEventPayload payload = get(path, params, OddsApiEventPayload.class);
        List<OddsData> odds = OddsApiMapper.toOdds(payload, eventId, clock.instant());
        logger.debug("Event {} has {} bookmaker markets", eventId, odds.size());
        return odds;
    }
}

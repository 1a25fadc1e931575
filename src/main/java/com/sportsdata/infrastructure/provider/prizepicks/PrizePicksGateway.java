package com.sportsdata.infrastructure.provider.prizepicks;

import com.sportsdata.domain.model.Projection;
import com.sportsdata.domain.ports.ProjectionsGateway;
import com.sportsdata.infrastructure.provider.HttpUpstreamGateway;
import com.sportsdata.infrastructure.provider.UpstreamEndpoint;
import com.sportsdata.infrastructure.provider.UpstreamHttpClient;
import com.sportsdata.infrastructure.provider.payload.PrizePicksProjectionsPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Player projections from the public PrizePicks board. The API takes no key.
 */
public class PrizePicksGateway extends HttpUpstreamGateway implements ProjectionsGateway {

    private static final Logger logger = LoggerFactory.getLogger(PrizePicksGateway.class);

    public PrizePicksGateway(UpstreamEndpoint endpoint, UpstreamHttpClient httpClient) {
        super(endpoint, httpClient);
    }

    @Override
    protected String apiKeyParam() {
        return null;
    }

    @Override
    public List<Projection> fetchProjections() {
        PrizePicksProjectionsPayload payload = get("/projections", Map.of(), PrizePicksProjectionsPayload.class);
        List<Projection> projections = PrizePicksMapper.toProjections(payload);
        logger.info("Fetched {} projections from PrizePicks", projections.size());
        return projections;
    }
}

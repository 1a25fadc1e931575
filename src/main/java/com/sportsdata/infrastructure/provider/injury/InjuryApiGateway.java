package com.sportsdata.infrastructure.provider.injury;

import com.sportsdata.domain.model.InjuryData;
import com.sportsdata.domain.ports.InjuryGateway;
import com.sportsdata.infrastructure.provider.HttpUpstreamGateway;
import com.sportsdata.infrastructure.provider.UpstreamEndpoint;
import com.sportsdata.infrastructure.provider.UpstreamHttpClient;
import com.sportsdata.infrastructure.provider.payload.InjuryReportPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Injury reports per sport.
 */
public class InjuryApiGateway extends HttpUpstreamGateway implements InjuryGateway {

    private static final Logger logger = LoggerFactory.getLogger(InjuryApiGateway.class);

    public InjuryApiGateway(UpstreamEndpoint endpoint, UpstreamHttpClient httpClient) {
        super(endpoint, httpClient);
    }

    @Override
    protected String apiKeyParam() {
        return "key";
    }

    @Override
    public List<InjuryData> fetchInjuries(String sport) {
        InjuryReportPayload payload = get(
            "/injuries/" + UpstreamHttpClient.pathSegment(sport), Map.of(), InjuryReportPayload.class);
        List<InjuryData> injuries = InjuryMapper.toInjuries(payload);
        logger.info("Fetched {} injuries for {}", injuries.size(), sport);
        return injuries;
    }
}

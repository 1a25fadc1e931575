package com.sportsdata.infrastructure.provider.sportradar;

import com.sportsdata.domain.model.GameData;
import com.sportsdata.domain.model.PlayerData;
import com.sportsdata.domain.ports.SportsStatsGateway;
import com.sportsdata.infrastructure.provider.HttpUpstreamGateway;
import com.sportsdata.infrastructure.provider.UpstreamEndpoint;
import com.sportsdata.infrastructure.provider.UpstreamHttpClient;
import com.sportsdata.infrastructure.provider.payload.SportradarGamePayload;
import com.sportsdata.infrastructure.provider.payload.SportradarPlayerPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Game and player statistics from Sportradar.
 */
public class SportradarGateway extends HttpUpstreamGateway implements SportsStatsGateway {

    private static final Logger logger = LoggerFactory.getLogger(SportradarGateway.class);

    public SportradarGateway(UpstreamEndpoint endpoint, UpstreamHttpClient httpClient) {
        super(endpoint, httpClient);
    }

    @Override
    protected String apiKeyParam() {
        return "api_key";
    }

    @Override
    public GameData fetchGame(String gameId) {
        logger.debug("Fetching game {} from Sportradar", gameId);
        SportradarGamePayload payload = get(
            "/games/" + UpstreamHttpClient.pathSegment(gameId), Map.of(), SportradarGamePayload.class);
        return SportradarMapper.toGame(payload);
    }

    @Override
    public PlayerData fetchPlayer(String playerId) {
        logger.debug("Fetching player {} from Sportradar", playerId);
        SportradarPlayerPayload payload = get(
            "/players/" + UpstreamHttpClient.pathSegment(playerId), Map.of(), SportradarPlayerPayload.class);
        return SportradarMapper.toPlayer(payload);
    }
}

package com.sportsdata.infrastructure.provider.prizepicks;

import com.sportsdata.domain.exception.TransformException;
import com.sportsdata.domain.model.Projection;
import com.sportsdata.infrastructure.provider.payload.PrizePicksProjectionsPayload;
import com.sportsdata.infrastructure.provider.payload.PrizePicksProjectionsPayload.IncludedAttributes;
import com.sportsdata.infrastructure.provider.payload.PrizePicksProjectionsPayload.IncludedResource;
import com.sportsdata.infrastructure.provider.payload.PrizePicksProjectionsPayload.ProjectionResource;
import com.sportsdata.infrastructure.provider.payload.PrizePicksProjectionsPayload.Relationship;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Resolves PrizePicks projections against the players in the {@code included} section.
 */
public class PrizePicksMapper {

    static final String SOURCE = "prizepicks";
    private static final String PLAYER_TYPE = "new_player";

    private PrizePicksMapper() {
    }

    public static List<Projection> toProjections(PrizePicksProjectionsPayload payload) {
        if (payload.data() == null) {
            throw new TransformException(SOURCE, "Projections payload has no data array");
        }

        Map<String, IncludedAttributes> players = new HashMap<>();
        if (payload.included() != null) {
            for (IncludedResource resource : payload.included()) {
                if (PLAYER_TYPE.equals(resource.type()) && resource.attributes() != null) {
                    players.put(resource.id(), resource.attributes());
                }
            }
        }

        return payload.data().stream()
            .map(resource -> toProjection(resource, players))
            .toList();
    }

    private static Projection toProjection(ProjectionResource resource, Map<String, IncludedAttributes> players) {
        if (resource.id() == null || resource.attributes() == null) {
            throw new TransformException(SOURCE, "Projection without id or attributes");
        }
        if (resource.attributes().lineScore() == null) {
            throw new TransformException(SOURCE, "Projection " + resource.id() + " has no line");
        }

        String playerId = relatedId(resource.relationships() != null ? resource.relationships().newPlayer() : null);
        String leagueId = relatedId(resource.relationships() != null ? resource.relationships().league() : null);
        IncludedAttributes player = playerId != null ? players.get(playerId) : null;

        String playerName = "";
        String team = "";
        String league = leagueId != null ? leagueId : "";
        if (player != null) {
            playerName = player.displayName() != null ? player.displayName() : nonNull(player.name());
            team = nonNull(player.team());
            if (player.league() != null) {
                league = player.league();
            }
        }

        var attributes = resource.attributes();
        return new Projection(
            resource.id(),
            playerId != null ? playerId : "",
            playerName,
            team,
            league,
            nonNull(attributes.statType()),
            attributes.lineScore(),
            attributes.startTime() != null ? attributes.startTime().toInstant() : null,
            nonNull(attributes.status())
        );
    }

    private static String relatedId(Relationship relationship) {
        return relationship != null && relationship.data() != null ? relationship.data().id() : null;
    }

    private static String nonNull(String value) {
        return value != null ? value : "";
    }
}

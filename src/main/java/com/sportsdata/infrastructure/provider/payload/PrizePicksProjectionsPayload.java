package com.sportsdata.infrastructure.provider.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * PrizePicks projection board ({@code GET /projections}), a JSON:API document whose
 * {@code included} array carries the referenced players.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PrizePicksProjectionsPayload(
    List<ProjectionResource> data,
    List<IncludedResource> included
) implements ProviderPayload {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProjectionResource(
        String id,
        String type,
        ProjectionAttributes attributes,
        Relationships relationships
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProjectionAttributes(
        @JsonProperty("line_score") BigDecimal lineScore,
        @JsonProperty("stat_type") String statType,
        @JsonProperty("start_time") OffsetDateTime startTime,
        String status
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Relationships(
        @JsonProperty("new_player") Relationship newPlayer,
        Relationship league
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Relationship(ResourceId data) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ResourceId(String id, String type) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record IncludedResource(String id, String type, IncludedAttributes attributes) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record IncludedAttributes(
        String name,
        @JsonProperty("display_name") String displayName,
        String team,
        String league
    ) {}
}

package com.sportsdata.infrastructure.provider.payload;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Injury report of one sport ({@code GET /injuries/{sport}}). The provider answers with a
 * bare JSON array.
 */
public record InjuryReportPayload(List<Entry> entries) implements ProviderPayload {

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static InjuryReportPayload of(List<Entry> entries) {
        return new InjuryReportPayload(entries == null ? List.of() : entries);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Entry(
        @JsonProperty("player_id") String playerId,
        String type,
        String severity,
        String status,
        @JsonProperty("expected_return") String expectedReturn,
        Double impact
    ) {}
}

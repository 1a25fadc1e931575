package com.sportsdata.infrastructure.provider.injury;

import com.sportsdata.domain.exception.TransformException;
import com.sportsdata.domain.model.InjuryData;
import com.sportsdata.domain.model.InjurySeverity;
import com.sportsdata.domain.model.InjuryStatus;
import com.sportsdata.infrastructure.provider.payload.InjuryReportPayload;

import java.util.List;

/**
 * Maps injury report entries. Missing severity, status and impact fall back to
 * minor, questionable and {@link InjuryData#DEFAULT_IMPACT}.
 */
public class InjuryMapper {

    static final String SOURCE = "injury-api";

    private InjuryMapper() {
    }

    public static List<InjuryData> toInjuries(InjuryReportPayload payload) {
        return payload.entries().stream()
            .map(InjuryMapper::toInjury)
            .toList();
    }

    private static InjuryData toInjury(InjuryReportPayload.Entry entry) {
        if (entry == null || entry.playerId() == null || entry.playerId().isBlank()) {
            throw new TransformException(SOURCE, "Injury entry has no player id");
        }
        return new InjuryData(
            entry.playerId(),
            entry.type() != null ? entry.type() : "unknown",
            InjurySeverity.fromProvider(entry.severity()),
            InjuryStatus.fromProvider(entry.status()),
            entry.expectedReturn(),
            entry.impact() != null && entry.impact() != 0 ? entry.impact() : InjuryData.DEFAULT_IMPACT
        );
    }
}

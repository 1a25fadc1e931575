package com.sportsdata.infrastructure.provider.payload;

/**
 * Raw response shape of one upstream endpoint, bound by Jackson before it is mapped
 * to the canonical model.
 */
public sealed interface ProviderPayload
    permits SportradarGamePayload, SportradarPlayerPayload, OddsApiEventPayload,
            PrizePicksProjectionsPayload, InjuryReportPayload, WeatherApiPayload {
}

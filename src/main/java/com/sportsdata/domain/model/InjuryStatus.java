package com.sportsdata.domain.model;

public enum InjuryStatus {
    QUESTIONABLE,
    DOUBTFUL,
    OUT,
    DAY_TO_DAY;

    public static InjuryStatus fromProvider(String raw) {
        if (raw == null || raw.isBlank()) {
            return QUESTIONABLE;
        }
        return switch (raw.trim().toLowerCase().replace('_', '-')) {
            case "doubtful" -> DOUBTFUL;
            case "out" -> OUT;
            case "day-to-day" -> DAY_TO_DAY;
            default -> QUESTIONABLE;
        };
    }
}

package com.sportsdata.domain.model;

public enum InjurySeverity {
    MINOR,
    MODERATE,
    MAJOR,
    SEASON_ENDING;

    public static InjurySeverity fromProvider(String raw) {
        if (raw == null || raw.isBlank()) {
            return MINOR;
        }
        return switch (raw.trim().toLowerCase().replace('_', '-')) {
            case "moderate" -> MODERATE;
            case "major" -> MAJOR;
            case "season-ending" -> SEASON_ENDING;
            default -> MINOR;
        };
    }
}

package com.sportsdata.domain.model;

/**
 * Lifecycle status of a game as reported by the stats provider.
 */
public enum GameStatus {
    SCHEDULED,
    LIVE,
    FINISHED,
    POSTPONED;

    /**
     * Maps a provider status string to a canonical status.
     * Unknown values are treated as SCHEDULED so the game stays eligible for odds refresh.
     */
    public static GameStatus fromProvider(String raw) {
        if (raw == null) {
            return SCHEDULED;
        }
        return switch (raw.trim().toLowerCase()) {
            case "inprogress", "in_progress", "live", "halftime" -> LIVE;
            case "closed", "complete", "completed", "finished", "final" -> FINISHED;
            case "postponed", "cancelled", "canceled", "suspended" -> POSTPONED;
            default -> SCHEDULED;
        };
    }
}

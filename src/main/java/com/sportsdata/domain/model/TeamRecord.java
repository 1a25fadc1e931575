package com.sportsdata.domain.model;

/**
 * Win/loss record of a team for the current season.
 */
public record TeamRecord(int wins, int losses, int ties) {

    public static TeamRecord empty() {
        return new TeamRecord(0, 0, 0);
    }
}

package com.flagship.player_progression.match;

import lombok.Builder;
import lombok.Value;

/**
 * One player's line of a completed match.
 */
@Value
@Builder
public class PlayerMatchStats {

    /**
     * Upper bound for every counter of a single match line. Keeps the
     * experience gain and the lifetime totals far from the BIGINT range.
     */
    public static final long MAX_PER_MATCH = 1_000_000_000L;

    Long playerId;
    long kills;
    long deaths;
    long wavesSurvived;
    long scrapEarned;
    long dataEarned;

    /**
     * @throws InvalidMatchStatsException on a missing player id or a counter
     *         outside {@code [0, MAX_PER_MATCH]}
     */
    public void validate() {
        if (playerId == null || playerId <= 0) {
            throw new InvalidMatchStatsException("player_id must be a positive number");
        }
        requireInRange("kills", kills);
        requireInRange("deaths", deaths);
        requireInRange("waves_survived", wavesSurvived);
        requireInRange("scrap_earned", scrapEarned);
        requireInRange("data_earned", dataEarned);
    }

    private void requireInRange(String field, long value) {
        if (value < 0) {
            throw new InvalidMatchStatsException(
                field + " must not be negative for player " + playerId + ": " + value);
        }
        if (value > MAX_PER_MATCH) {
            throw new InvalidMatchStatsException(
                field + " must be at most " + MAX_PER_MATCH + " for player " + playerId + ": " + value);
        }
    }
}

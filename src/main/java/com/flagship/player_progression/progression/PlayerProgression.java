package com.flagship.player_progression.progression;

import lombok.Value;

import java.time.Instant;

/**
 * Durable per-player economic state.
 *
 * Invariants (also enforced by CHECK constraints):
 * - level >= 1
 * - experience >= 0, cumulative, reset only by prestige
 * - prestigeLevel >= 0
 * - currencyBalance >= 0
 */
@Value
public class PlayerProgression {
    Long playerId;
    int level;
    long experience;
    int prestigeLevel;
    long currencyBalance;
    long totalMatchesPlayed;
    long totalKills;
    long totalDeaths;
    long totalWavesSurvived;
    long totalScrapEarned;
    long totalCurrencyEarned;
    Instant updatedAt;

    /**
     * Copy with the level replaced, used when a lagging stored level is repaired on read.
     */
    public PlayerProgression withLevel(int newLevel) {
        return new PlayerProgression(playerId, newLevel, experience, prestigeLevel, currencyBalance,
                totalMatchesPlayed, totalKills, totalDeaths, totalWavesSurvived,
                totalScrapEarned, totalCurrencyEarned, updatedAt);
    }
}

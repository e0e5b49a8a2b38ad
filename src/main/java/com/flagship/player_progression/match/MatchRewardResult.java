package com.flagship.player_progression.match;

import lombok.Value;

import java.util.List;

/**
 * What one player received from one match.
 */
@Value
public class MatchRewardResult {
    Long playerId;
    long experienceAwarded;
    long currencyAwarded;
    long experience;
    int previousLevel;
    int level;
    long currencyBalance;
    List<Long> unlockedCosmeticIds;

    public boolean isLeveledUp() {
        return level > previousLevel;
    }
}

package com.flagship.player_progression.progression;

import lombok.Value;

import java.util.List;

/**
 * Outcome of applying experience to a player.
 *
 * {@code newLevel} is always derived from {@code experience}. {@code levelRecorded}
 * is false when the level column could not be updated; it is repaired on the
 * next read.
 */
@Value
public class LevelProgress {
    Long playerId;
    long experienceGained;
    long experience;
    int previousLevel;
    int newLevel;
    boolean levelRecorded;
    List<Long> unlockedCosmeticIds;

    public boolean isLeveledUp() {
        return newLevel > previousLevel;
    }
}

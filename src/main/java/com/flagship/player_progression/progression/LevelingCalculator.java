package com.flagship.player_progression.progression;

import com.flagship.player_progression.config.ProgressionProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Maps cumulative experience to a level: {@code max(1, floor(xp / base) + 1)}.
 *
 * Levels stop at {@link #MAX_LEVEL}; past that point more experience is still
 * stored but no longer counts towards a next level.
 */
@Component
@Slf4j
public class LevelingCalculator {

    public static final int MAX_LEVEL = Integer.MAX_VALUE;

    private final long baseXpPerLevel;

    @Autowired
    public LevelingCalculator(ProgressionProperties properties) {
        this(properties.getLeveling().getBaseXpPerLevel());
    }

    public LevelingCalculator(long configuredBaseXpPerLevel) {
        if (configuredBaseXpPerLevel <= 0) {
            log.warn("Invalid base XP per level {}, falling back to {}",
                    configuredBaseXpPerLevel, ProgressionProperties.DEFAULT_BASE_XP_PER_LEVEL);
            this.baseXpPerLevel = ProgressionProperties.DEFAULT_BASE_XP_PER_LEVEL;
        } else {
            this.baseXpPerLevel = configuredBaseXpPerLevel;
        }
    }

    public int levelFor(long experience) {
        if (experience <= 0) {
            return 1;
        }
        long level = experience / baseXpPerLevel + 1;
        return (int) Math.min(level, MAX_LEVEL);
    }

    /**
     * Cumulative experience at which {@code level} starts.
     */
    public long experienceForLevel(int level) {
        if (level <= 1) {
            return 0;
        }
        return Math.multiplyExact(level - 1L, baseXpPerLevel);
    }

    /**
     * Zero at {@link #MAX_LEVEL}.
     */
    public long experienceToNextLevel(long experience) {
        long current = Math.max(0, experience);
        int level = levelFor(current);
        if (level >= MAX_LEVEL) {
            return 0;
        }
        return experienceForLevel(level + 1) - current;
    }

    public boolean crossesLevelBoundary(long previousExperience, long newExperience) {
        return levelFor(newExperience) > levelFor(previousExperience);
    }

    public long getBaseXpPerLevel() {
        return baseXpPerLevel;
    }
}

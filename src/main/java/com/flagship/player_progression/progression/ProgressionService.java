package com.flagship.player_progression.progression;

import com.flagship.player_progression.cosmetic.CosmeticCatalog;
import com.flagship.player_progression.cosmetic.CosmeticItem;
import com.flagship.player_progression.cosmetic.CosmeticOwnershipStore;
import com.flagship.player_progression.cosmetic.UnlockMethod;
import com.flagship.player_progression.event.CosmeticUnlockedEvent;
import com.flagship.player_progression.event.PlayerLeveledUpEvent;
import com.flagship.player_progression.observability.ProgressionMetrics;
import com.flagship.player_progression.outbox.OutboxService;
import com.flagship.player_progression.transaction.FollowUpEffects;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reads progression and applies experience.
 *
 * Adding experience is the primary mutation. Recording the new level and
 * granting level-up cosmetics are follow-up effects: if they fail the
 * experience still commits, because the level can always be recomputed from it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProgressionService {

    static final String EFFECT_RECORD_LEVEL = "record-level";
    static final String EFFECT_LEVEL_UNLOCK = "level-up-unlock";

    private final ProgressionStore progressionStore;
    private final LevelingCalculator levelingCalculator;
    private final CosmeticCatalog cosmeticCatalog;
    private final CosmeticOwnershipStore ownershipStore;
    private final FollowUpEffects followUpEffects;
    private final OutboxService outboxService;
    private final ProgressionMetrics metrics;

    /**
     * Returns the player's progression, creating the default row on first
     * access. A stored level that lags behind the experience is repaired.
     */
    @Transactional
    public PlayerProgression getProgression(Long playerId) {
        progressionStore.ensureExists(playerId);
        PlayerProgression progression = progressionStore.find(playerId)
                .orElseThrow(() -> new IllegalStateException("No progression row for player " + playerId));

        int derivedLevel = levelingCalculator.levelFor(progression.getExperience());
        if (derivedLevel > progression.getLevel()) {
            log.info("Repairing stale level: playerId={}, stored={}, derived={}",
                    playerId, progression.getLevel(), derivedLevel);
            progressionStore.raiseLevel(playerId, derivedLevel);
            return progression.withLevel(derivedLevel);
        }
        return progression;
    }

    public long experienceToNextLevel(PlayerProgression progression) {
        return levelingCalculator.experienceToNextLevel(progression.getExperience());
    }

    /**
     * Adds experience inside the caller's transaction and records any level
     * increase. The progression row must already exist.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public LevelProgress applyExperience(Long playerId, long experience) {
        if (experience < 0) {
            throw new IllegalArgumentException("Experience gain must not be negative: " + experience);
        }

        ProgressionStore.ExperienceUpdate update = progressionStore.addExperience(playerId, experience);
        int previousLevel = update.getStoredLevel();
        int newLevel = Math.max(previousLevel, levelingCalculator.levelFor(update.getExperience()));

        if (newLevel == previousLevel) {
            return new LevelProgress(playerId, experience, update.getExperience(),
                    previousLevel, newLevel, true, Collections.emptyList());
        }

        boolean recorded = followUpEffects.run(EFFECT_RECORD_LEVEL, playerId,
                () -> progressionStore.raiseLevel(playerId, newLevel));
        if (recorded) {
            outboxService.saveEvent(PlayerLeveledUpEvent.of(playerId, previousLevel, newLevel, update.getExperience()));
            metrics.incrementLevelUps();
            log.info("Player leveled up: playerId={}, {} -> {}, experience={}",
                    playerId, previousLevel, newLevel, update.getExperience());
        }

        List<Long> unlocked = grantLevelRewards(playerId, previousLevel, newLevel);
        return new LevelProgress(playerId, experience, update.getExperience(),
                previousLevel, newLevel, recorded, unlocked);
    }

    private List<Long> grantLevelRewards(Long playerId, int previousLevel, int newLevel) {
        List<CosmeticItem> rewards = cosmeticCatalog.findUnownedLevelRewards(playerId, previousLevel, newLevel);
        List<Long> unlocked = new ArrayList<>();
        for (CosmeticItem reward : rewards) {
            Boolean granted = followUpEffects.call(EFFECT_LEVEL_UNLOCK, playerId,
                    () -> ownershipStore.grantIfAbsent(playerId, reward.getCosmeticId(), UnlockMethod.LEVEL_UP));
            if (Boolean.TRUE.equals(granted)) {
                unlocked.add(reward.getCosmeticId());
                outboxService.saveEvent(CosmeticUnlockedEvent.of(
                        playerId, reward.getCosmeticId(), UnlockMethod.LEVEL_UP.getDbValue()));
            }
        }
        return unlocked;
    }
}

package com.flagship.player_progression.progression;

import com.flagship.player_progression.cosmetic.CosmeticCatalog;
import com.flagship.player_progression.cosmetic.CosmeticItem;
import com.flagship.player_progression.cosmetic.CosmeticOwnershipStore;
import com.flagship.player_progression.cosmetic.UnlockMethod;
import com.flagship.player_progression.event.CosmeticUnlockedEvent;
import com.flagship.player_progression.event.PlayerPrestigedEvent;
import com.flagship.player_progression.observability.CorrelationContext;
import com.flagship.player_progression.observability.ProgressionMetrics;
import com.flagship.player_progression.outbox.OutboxService;
import com.flagship.player_progression.transaction.FollowUpEffects;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * Resets level and experience, advances the prestige tier and grants the
 * tier's exclusive cosmetics.
 *
 * Not idempotent: each call advances one tier. Callers must only invoke it on
 * an explicit player action, never from an automatic retry.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PrestigeService {

    static final String EFFECT_PRESTIGE_GRANT = "prestige-cosmetic-grant";

    private final ProgressionStore progressionStore;
    private final CosmeticCatalog cosmeticCatalog;
    private final CosmeticOwnershipStore ownershipStore;
    private final FollowUpEffects followUpEffects;
    private final OutboxService outboxService;
    private final ProgressionMetrics metrics;

    @Transactional
    public PrestigeResult prestigePlayer(Long playerId) {
        long startTime = System.currentTimeMillis();
        CorrelationContext.enterPlayerScope(playerId, "prestige");
        progressionStore.ensureExists(playerId);
        int prestigeLevel = progressionStore.resetForPrestige(playerId);

        List<Long> granted = new ArrayList<>();
        for (CosmeticItem reward : cosmeticCatalog.findUnownedPrestigeRewards(playerId, prestigeLevel)) {
            Boolean created = followUpEffects.call(EFFECT_PRESTIGE_GRANT, playerId,
                    () -> ownershipStore.grantIfAbsent(playerId, reward.getCosmeticId(), UnlockMethod.PRESTIGE));
            if (Boolean.TRUE.equals(created)) {
                granted.add(reward.getCosmeticId());
                outboxService.saveEvent(CosmeticUnlockedEvent.of(
                        playerId, reward.getCosmeticId(), UnlockMethod.PRESTIGE.getDbValue()));
            } else if (created != null) {
                log.info("Prestige cosmetic already owned, skipping: playerId={}, cosmeticId={}",
                        playerId, reward.getCosmeticId());
            }
        }

        outboxService.saveEvent(PlayerPrestigedEvent.of(playerId, prestigeLevel, granted));
        metrics.incrementPrestige();
        metrics.recordLatency("prestige", System.currentTimeMillis() - startTime);

        log.info("Player prestiged: playerId={}, prestigeLevel={}, grantedCosmetics={}",
                playerId, prestigeLevel, granted);
        return new PrestigeResult(playerId, prestigeLevel, List.copyOf(granted));
    }
}

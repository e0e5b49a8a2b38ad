package com.flagship.player_progression.loot;

import com.flagship.player_progression.cosmetic.CosmeticCatalog;
import com.flagship.player_progression.cosmetic.CosmeticItem;
import com.flagship.player_progression.cosmetic.CosmeticNotFoundException;
import com.flagship.player_progression.cosmetic.CosmeticOwnershipStore;
import com.flagship.player_progression.cosmetic.UnlockMethod;
import com.flagship.player_progression.event.CosmeticUnlockedEvent;
import com.flagship.player_progression.observability.CorrelationContext;
import com.flagship.player_progression.observability.ProgressionMetrics;
import com.flagship.player_progression.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Rolls the active loot tables and grants the result.
 *
 * Rolling a cosmetic the player already owns is a successful drop that
 * changes nothing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LootDropService {

    private final LootTableRepository tableRepository;
    private final LootTableEntryRepository entryRepository;
    private final WeightedLootSelector selector;
    private final CosmeticCatalog catalog;
    private final CosmeticOwnershipStore ownershipStore;
    private final OutboxService outboxService;
    private final ProgressionMetrics metrics;

    @Transactional
    public LootDropResult generateLootDrop(Long playerId) {
        long startTime = System.currentTimeMillis();
        CorrelationContext.enterPlayerScope(playerId, "loot-drop");
        try {
            List<LootTable> tables = tableRepository.findByActiveTrueOrderByIdAsc().stream()
                    .map(LootTableEntity::toDomain)
                    .toList();
            LootTable table = selector.selectTable(tables);

            List<LootTableEntry> entries = entryRepository.findByLootTableIdOrderByIdAsc(table.getLootTableId())
                    .stream()
                    .map(LootTableEntryEntity::toDomain)
                    .toList();
            LootTableEntry entry = selector.selectEntry(entries);

            CosmeticItem cosmetic = catalog.findById(entry.getCosmeticId())
                    .orElseThrow(() -> new CosmeticNotFoundException(entry.getCosmeticId()));

            boolean granted = ownershipStore.grantIfAbsent(playerId, cosmetic.getCosmeticId(), UnlockMethod.LOOT_DROP);
            if (granted) {
                outboxService.saveEvent(CosmeticUnlockedEvent.of(
                        playerId, cosmetic.getCosmeticId(), UnlockMethod.LOOT_DROP.getDbValue()));
                metrics.recordLootDrop("granted");
                log.info("Loot dropped: playerId={}, lootTableId={}, cosmeticId={}",
                        playerId, table.getLootTableId(), cosmetic.getCosmeticId());
            } else {
                metrics.recordLootDrop("duplicate");
                log.debug("Loot drop already owned: playerId={}, lootTableId={}, cosmeticId={}",
                        playerId, table.getLootTableId(), cosmetic.getCosmeticId());
            }
            metrics.recordLatency("loot-drop", System.currentTimeMillis() - startTime);

            return new LootDropResult(cosmetic, table.getLootTableId(), granted);

        } catch (LootConfigurationException e) {
            metrics.recordLootDrop(e.getReason().name().toLowerCase());
            log.info("No loot drop: playerId={}, reason={}", playerId, e.getReason());
            throw e;
        }
    }
}

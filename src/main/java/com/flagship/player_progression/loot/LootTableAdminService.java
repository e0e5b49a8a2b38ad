package com.flagship.player_progression.loot;

import com.flagship.player_progression.cosmetic.CosmeticCatalog;
import com.flagship.player_progression.cosmetic.CosmeticNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Objects;

/**
 * Operator CRUD for loot tables and their entries.
 *
 * Rules checked here (the schema repeats them as CHECK constraints):
 * drop chance in [0, 1], weight at least 1, 1 <= min quantity <= max quantity,
 * the cosmetic exists, and a cosmetic appears at most once per table.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LootTableAdminService {

    private final LootTableRepository tableRepository;
    private final LootTableEntryRepository entryRepository;
    private final CosmeticCatalog catalog;

    public List<LootTable> listTables() {
        return tableRepository.findAllByOrderByIdAsc().stream()
                .map(LootTableEntity::toDomain)
                .toList();
    }

    public LootTable getTable(Long lootTableId) {
        return findTable(lootTableId).toDomain();
    }

    @Transactional
    public LootTable createTable(String name, String description, double dropChance, boolean active) {
        validateTable(name, dropChance);
        LootTableEntity saved = tableRepository.save(
                LootTableEntity.create(name.trim(), description, dropChance, active));
        log.info("Loot table created: lootTableId={}, name={}, dropChance={}, active={}",
                saved.getId(), saved.getName(), dropChance, active);
        return saved.toDomain();
    }

    @Transactional
    public LootTable updateTable(Long lootTableId, String name, String description,
                                 double dropChance, boolean active) {
        validateTable(name, dropChance);
        LootTableEntity entity = findTable(lootTableId);
        entity.update(name.trim(), description, dropChance, active);
        log.info("Loot table updated: lootTableId={}, dropChance={}, active={}", lootTableId, dropChance, active);
        return tableRepository.save(entity).toDomain();
    }

    /**
     * Deletes the table; its entries go with it (ON DELETE CASCADE).
     */
    @Transactional
    public void deleteTable(Long lootTableId) {
        LootTableEntity entity = findTable(lootTableId);
        tableRepository.delete(entity);
        log.info("Loot table deleted: lootTableId={}", lootTableId);
    }

    public List<LootTableEntry> listEntries(Long lootTableId) {
        findTable(lootTableId);
        return entryRepository.findByLootTableIdOrderByIdAsc(lootTableId).stream()
                .map(LootTableEntryEntity::toDomain)
                .toList();
    }

    public LootTableEntry getEntry(Long lootTableId, Long entryId) {
        return findEntry(lootTableId, entryId).toDomain();
    }

    @Transactional
    public LootTableEntry addEntry(Long lootTableId, Long cosmeticId, int weight,
                                   int minQuantity, int maxQuantity) {
        findTable(lootTableId);
        validateEntry(cosmeticId, weight, minQuantity, maxQuantity);
        if (entryRepository.existsByLootTableIdAndCosmeticId(lootTableId, cosmeticId)) {
            throw new DuplicateLootEntryException(lootTableId, cosmeticId);
        }

        LootTableEntryEntity saved = entryRepository.save(
                LootTableEntryEntity.create(lootTableId, cosmeticId, weight, minQuantity, maxQuantity));
        log.info("Loot table entry added: lootTableId={}, entryId={}, cosmeticId={}, weight={}",
                lootTableId, saved.getId(), cosmeticId, weight);
        return saved.toDomain();
    }

    @Transactional
    public LootTableEntry updateEntry(Long lootTableId, Long entryId, Long cosmeticId, int weight,
                                      int minQuantity, int maxQuantity) {
        LootTableEntryEntity entity = findEntry(lootTableId, entryId);
        validateEntry(cosmeticId, weight, minQuantity, maxQuantity);
        if (!Objects.equals(entity.getCosmeticId(), cosmeticId)
                && entryRepository.existsByLootTableIdAndCosmeticId(lootTableId, cosmeticId)) {
            throw new DuplicateLootEntryException(lootTableId, cosmeticId);
        }

        entity.update(cosmeticId, weight, minQuantity, maxQuantity);
        log.info("Loot table entry updated: lootTableId={}, entryId={}, weight={}", lootTableId, entryId, weight);
        return entryRepository.save(entity).toDomain();
    }

    @Transactional
    public void deleteEntry(Long lootTableId, Long entryId) {
        entryRepository.delete(findEntry(lootTableId, entryId));
        log.info("Loot table entry deleted: lootTableId={}, entryId={}", lootTableId, entryId);
    }

    private LootTableEntity findTable(Long lootTableId) {
        return tableRepository.findById(lootTableId)
                .orElseThrow(() -> new LootTableNotFoundException(lootTableId));
    }

    private LootTableEntryEntity findEntry(Long lootTableId, Long entryId) {
        return entryRepository.findByIdAndLootTableId(entryId, lootTableId)
                .orElseThrow(() -> new LootTableEntryNotFoundException(entryId));
    }

    private void validateTable(String name, double dropChance) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Loot table name is required");
        }
        if (Double.isNaN(dropChance) || dropChance < 0.0 || dropChance > 1.0) {
            throw new IllegalArgumentException("drop_chance must be between 0 and 1");
        }
    }

    private void validateEntry(Long cosmeticId, int weight, int minQuantity, int maxQuantity) {
        if (weight < 1) {
            throw new IllegalArgumentException("weight must be at least 1");
        }
        if (minQuantity < 1 || maxQuantity < minQuantity) {
            throw new IllegalArgumentException("invalid quantity range");
        }
        if (cosmeticId == null || !catalog.exists(cosmeticId)) {
            throw new CosmeticNotFoundException(cosmeticId);
        }
    }
}

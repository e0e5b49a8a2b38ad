package com.flagship.player_progression.loot;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Random;

/**
 * The two random draws behind a loot drop: which table fires, then which
 * entry of that table is awarded.
 */
@Component
public class WeightedLootSelector {

    private final Random random;

    public WeightedLootSelector(@Qualifier("lootRandom") Random random) {
        this.random = random;
    }

    /**
     * Rolls each table in order and returns the first whose roll lands below
     * its drop chance.
     *
     * @throws LootConfigurationException NO_ACTIVE_LOOT_TABLES or NO_DROP_FROM_ANY_TABLE
     */
    public LootTable selectTable(List<LootTable> activeTables) {
        if (activeTables.isEmpty()) {
            throw new LootConfigurationException(LootConfigurationException.Reason.NO_ACTIVE_LOOT_TABLES,
                    "No active loot tables are configured");
        }
        for (LootTable table : activeTables) {
            if (random.nextDouble() < table.getDropChance()) {
                return table;
            }
        }
        throw new LootConfigurationException(LootConfigurationException.Reason.NO_DROP_FROM_ANY_TABLE,
                "No loot table produced a drop");
    }

    /**
     * Picks an entry with probability weight / totalWeight.
     *
     * @throws LootConfigurationException EMPTY_LOOT_TABLE or NON_POSITIVE_WEIGHT
     */
    public LootTableEntry selectEntry(List<LootTableEntry> entries) {
        if (entries.isEmpty()) {
            throw new LootConfigurationException(LootConfigurationException.Reason.EMPTY_LOOT_TABLE,
                    "Loot table has no entries");
        }

        long totalWeight = 0;
        for (LootTableEntry entry : entries) {
            totalWeight += entry.getWeight();
        }
        if (totalWeight <= 0) {
            throw new LootConfigurationException(LootConfigurationException.Reason.NON_POSITIVE_WEIGHT,
                    "Loot table weights sum to " + totalWeight);
        }

        long draw = random.nextLong(totalWeight);
        long cumulative = 0;
        for (LootTableEntry entry : entries) {
            cumulative += entry.getWeight();
            if (draw < cumulative) {
                return entry;
            }
        }
        // Unreachable with non-negative weights; negative ones can skew the walk.
        return entries.get(entries.size() - 1);
    }
}

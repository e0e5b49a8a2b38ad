package com.flagship.player_progression.loot;

import lombok.Value;

@Value
public class LootTableEntry {
    Long entryId;
    Long lootTableId;
    Long cosmeticId;
    int weight;
    int minQuantity;
    int maxQuantity;
}

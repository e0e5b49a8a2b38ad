package com.flagship.player_progression.loot;

import lombok.Value;

import java.time.Instant;

/**
 * A weighted reward distribution gated by an overall drop chance in [0, 1].
 */
@Value
public class LootTable {
    Long lootTableId;
    String name;
    String description;
    double dropChance;
    boolean active;
    Instant createdAt;
    Instant updatedAt;
}

package com.flagship.player_progression.cosmetic;

import lombok.Value;

import java.time.Instant;

/**
 * Catalog entry. The catalog is maintained by content tooling; this service only reads it.
 *
 * For prestige-only items {@code unlockLevel} is the prestige tier that grants them.
 */
@Value
public class CosmeticItem {
    Long cosmeticId;
    String name;
    String description;
    CosmeticSlot slot;
    String category;
    Rarity rarity;
    int unlockLevel;
    long dataCost;
    boolean prestigeOnly;
    Instant createdAt;
}

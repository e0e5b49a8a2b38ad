package com.flagship.player_progression.loot;

import com.flagship.player_progression.cosmetic.CosmeticItem;
import lombok.Value;

/**
 * Outcome of a drop. {@code newlyGranted} is false when the player already
 * owned the rolled cosmetic.
 */
@Value
public class LootDropResult {
    CosmeticItem cosmetic;
    Long lootTableId;
    boolean newlyGranted;
}

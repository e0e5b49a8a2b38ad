package com.flagship.player_progression.loot.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.player_progression.cosmetic.dto.CosmeticResponse;
import com.flagship.player_progression.loot.LootDropResult;
import lombok.Value;

@Value
public class LootDropResponse {

    @JsonProperty("cosmetic")
    CosmeticResponse cosmetic;

    @JsonProperty("loot_table_id")
    Long lootTableId;

    @JsonProperty("newly_granted")
    boolean newlyGranted;

    public static LootDropResponse from(LootDropResult result) {
        return new LootDropResponse(
            CosmeticResponse.from(result.getCosmetic()),
            result.getLootTableId(),
            result.isNewlyGranted()
        );
    }
}

package com.flagship.player_progression.loot.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.player_progression.cosmetic.dto.CosmeticResponse;
import com.flagship.player_progression.loot.LootTableEntry;
import lombok.Value;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LootTableEntryResponse {

    @JsonProperty("entry_id")
    Long entryId;

    @JsonProperty("loot_table_id")
    Long lootTableId;

    @JsonProperty("cosmetic_id")
    Long cosmeticId;

    @JsonProperty("weight")
    int weight;

    @JsonProperty("min_quantity")
    int minQuantity;

    @JsonProperty("max_quantity")
    int maxQuantity;

    /** Present in table listings only. */
    @JsonProperty("cosmetic")
    CosmeticResponse cosmetic;

    public static LootTableEntryResponse from(LootTableEntry entry, CosmeticResponse cosmetic) {
        return new LootTableEntryResponse(
            entry.getEntryId(),
            entry.getLootTableId(),
            entry.getCosmeticId(),
            entry.getWeight(),
            entry.getMinQuantity(),
            entry.getMaxQuantity(),
            cosmetic
        );
    }
}

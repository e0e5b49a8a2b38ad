package com.flagship.player_progression.cosmetic.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.player_progression.cosmetic.CosmeticItem;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class CosmeticResponse {

    @JsonProperty("cosmetic_id")
    Long cosmeticId;

    @JsonProperty("name")
    String name;

    @JsonProperty("description")
    String description;

    @JsonProperty("slot")
    String slot;

    @JsonProperty("category")
    String category;

    @JsonProperty("rarity")
    String rarity;

    @JsonProperty("unlock_level")
    int unlockLevel;

    @JsonProperty("data_cost")
    long dataCost;

    @JsonProperty("is_prestige_only")
    boolean prestigeOnly;

    public static CosmeticResponse from(CosmeticItem item) {
        return CosmeticResponse.builder()
            .cosmeticId(item.getCosmeticId())
            .name(item.getName())
            .description(item.getDescription())
            .slot(item.getSlot().getDbValue())
            .category(item.getCategory())
            .rarity(item.getRarity().getDbValue())
            .unlockLevel(item.getUnlockLevel())
            .dataCost(item.getDataCost())
            .prestigeOnly(item.isPrestigeOnly())
            .build();
    }
}

package com.flagship.player_progression.loot.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Value;

/**
 * Quantities default to 1 when omitted.
 */
@Value
public class LootTableEntryRequest {

    @NotNull(message = "cosmetic_id is required")
    @Positive(message = "cosmetic_id must be positive")
    @JsonProperty("cosmetic_id")
    Long cosmeticId;

    @NotNull(message = "weight is required")
    @Min(value = 1, message = "weight must be at least 1")
    @JsonProperty("weight")
    Integer weight;

    @JsonProperty("min_quantity")
    Integer minQuantity;

    @JsonProperty("max_quantity")
    Integer maxQuantity;

    public int minQuantityOrDefault() {
        return minQuantity == null ? 1 : minQuantity;
    }

    public int maxQuantityOrDefault() {
        return maxQuantity == null ? minQuantityOrDefault() : maxQuantity;
    }
}

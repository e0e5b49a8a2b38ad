package com.flagship.player_progression.cosmetic.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Value;

/**
 * Body of equip and purchase requests.
 */
@Value
public class CosmeticIdRequest {

    @NotNull(message = "cosmetic_id is required")
    @Positive(message = "cosmetic_id must be positive")
    @JsonProperty("cosmetic_id")
    Long cosmeticId;
}

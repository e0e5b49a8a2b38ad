package com.flagship.player_progression.loot.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

/**
 * Create or replace a loot table. {@code is_active} defaults to true.
 */
@Value
public class LootTableRequest {

    @NotBlank(message = "name is required")
    @Size(max = 100, message = "name must be at most 100 characters")
    @JsonProperty("name")
    String name;

    @JsonProperty("description")
    String description;

    @NotNull(message = "drop_chance is required")
    @DecimalMin(value = "0.0", message = "drop_chance must be between 0 and 1")
    @DecimalMax(value = "1.0", message = "drop_chance must be between 0 and 1")
    @JsonProperty("drop_chance")
    Double dropChance;

    @JsonProperty("is_active")
    Boolean active;

    public boolean isActiveOrDefault() {
        return active == null || active;
    }
}

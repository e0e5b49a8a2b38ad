package com.flagship.player_progression.loot.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.player_progression.loot.LootTable;
import lombok.Value;

import java.time.Instant;

@Value
public class LootTableResponse {

    @JsonProperty("loot_table_id")
    Long lootTableId;

    @JsonProperty("name")
    String name;

    @JsonProperty("description")
    String description;

    @JsonProperty("drop_chance")
    double dropChance;

    @JsonProperty("is_active")
    boolean active;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static LootTableResponse from(LootTable table) {
        return new LootTableResponse(
            table.getLootTableId(),
            table.getName(),
            table.getDescription(),
            table.getDropChance(),
            table.isActive(),
            table.getCreatedAt(),
            table.getUpdatedAt()
        );
    }
}

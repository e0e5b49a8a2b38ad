package com.flagship.player_progression.cosmetic;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum Rarity {
    COMMON,
    UNCOMMON,
    RARE,
    EPIC,
    LEGENDARY;

    @JsonValue
    public String getDbValue() {
        return name().toLowerCase();
    }

    public static Rarity fromDbValue(String value) {
        return Arrays.stream(values())
                .filter(rarity -> rarity.getDbValue().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown rarity: " + value));
    }
}

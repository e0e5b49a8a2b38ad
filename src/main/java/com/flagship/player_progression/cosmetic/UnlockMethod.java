package com.flagship.player_progression.cosmetic;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * How a player came to own a cosmetic. Recorded once, at grant time.
 */
public enum UnlockMethod {
    LEVEL_UP("level_up"),
    PURCHASE("purchase"),
    LOOT_DROP("loot_drop"),
    PRESTIGE("prestige");

    private final String dbValue;

    UnlockMethod(String dbValue) {
        this.dbValue = dbValue;
    }

    @JsonValue
    public String getDbValue() {
        return dbValue;
    }

    public static UnlockMethod fromDbValue(String value) {
        return Arrays.stream(values())
                .filter(method -> method.dbValue.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown unlock method: " + value));
    }
}

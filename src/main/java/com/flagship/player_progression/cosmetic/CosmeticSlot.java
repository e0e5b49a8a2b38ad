package com.flagship.player_progression.cosmetic;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Loadout slot a cosmetic occupies. A loadout holds at most one cosmetic per slot.
 */
public enum CosmeticSlot {
    CHARACTER_SKIN("character_skin"),
    WEAPON_SKIN("weapon_skin"),
    EMOTE("emote"),
    TAUNT("taunt"),
    BADGE("badge"),
    TITLE("title"),
    PARTICLE_EFFECT("particle_effect"),
    OTHER("other");

    private final String dbValue;

    CosmeticSlot(String dbValue) {
        this.dbValue = dbValue;
    }

    @JsonValue
    public String getDbValue() {
        return dbValue;
    }

    @JsonCreator
    public static CosmeticSlot fromDbValue(String value) {
        return Arrays.stream(values())
                .filter(slot -> slot.dbValue.equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown cosmetic slot: " + value));
    }
}

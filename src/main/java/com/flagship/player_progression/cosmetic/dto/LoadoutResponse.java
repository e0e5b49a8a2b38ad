package com.flagship.player_progression.cosmetic.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.player_progression.cosmetic.Loadout;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

@Value
public class LoadoutResponse {

    @JsonProperty("loadout_id")
    Long loadoutId;

    @JsonProperty("name")
    String name;

    @JsonProperty("is_active")
    boolean active;

    /** slot -> cosmetic id */
    @JsonProperty("slots")
    Map<String, Long> slots;

    public static LoadoutResponse from(Loadout loadout) {
        Map<String, Long> slots = new LinkedHashMap<>();
        for (Loadout.SlotAssignment assignment : loadout.getAssignments()) {
            slots.put(assignment.getSlot().getDbValue(), assignment.getCosmeticId());
        }
        return new LoadoutResponse(loadout.getLoadoutId(), loadout.getName(), loadout.isActive(), slots);
    }
}

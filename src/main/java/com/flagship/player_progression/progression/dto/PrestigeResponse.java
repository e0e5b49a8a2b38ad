package com.flagship.player_progression.progression.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.player_progression.progression.PrestigeResult;
import lombok.Value;

import java.util.List;

@Value
public class PrestigeResponse {

    @JsonProperty("player_id")
    Long playerId;

    @JsonProperty("prestige_level")
    int prestigeLevel;

    @JsonProperty("granted_cosmetic_ids")
    List<Long> grantedCosmeticIds;

    public static PrestigeResponse from(PrestigeResult result) {
        return new PrestigeResponse(result.getPlayerId(), result.getPrestigeLevel(), result.getGrantedCosmeticIds());
    }
}

package com.flagship.player_progression.cosmetic.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.player_progression.cosmetic.OwnedCosmetic;
import lombok.Value;

import java.time.Instant;

@Value
public class OwnedCosmeticResponse {

    @JsonProperty("cosmetic")
    CosmeticResponse cosmetic;

    @JsonProperty("unlocked_at")
    Instant unlockedAt;

    @JsonProperty("unlocked_via")
    String unlockedVia;

    public static OwnedCosmeticResponse from(OwnedCosmetic owned) {
        return new OwnedCosmeticResponse(
            CosmeticResponse.from(owned.getItem()),
            owned.getUnlockedAt(),
            owned.getUnlockedVia().getDbValue()
        );
    }
}

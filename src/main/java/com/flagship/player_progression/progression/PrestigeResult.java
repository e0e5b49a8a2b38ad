package com.flagship.player_progression.progression;

import lombok.Value;

import java.util.List;

@Value
public class PrestigeResult {
    Long playerId;
    int prestigeLevel;
    List<Long> grantedCosmeticIds;
}

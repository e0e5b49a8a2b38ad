package com.flagship.player_progression.match.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.player_progression.match.MatchRewardResult;
import lombok.Value;

import java.util.List;

@Value
public class PlayerRewardResponse {

    @JsonProperty("player_id")
    Long playerId;

    @JsonProperty("experience_awarded")
    long experienceAwarded;

    @JsonProperty("data_awarded")
    long dataAwarded;

    @JsonProperty("experience")
    long experience;

    @JsonProperty("level")
    int level;

    @JsonProperty("leveled_up")
    boolean leveledUp;

    @JsonProperty("data_currency")
    long dataCurrency;

    @JsonProperty("unlocked_cosmetic_ids")
    List<Long> unlockedCosmeticIds;

    public static PlayerRewardResponse from(MatchRewardResult result) {
        return new PlayerRewardResponse(
            result.getPlayerId(),
            result.getExperienceAwarded(),
            result.getCurrencyAwarded(),
            result.getExperience(),
            result.getLevel(),
            result.isLeveledUp(),
            result.getCurrencyBalance(),
            result.getUnlockedCosmeticIds()
        );
    }
}

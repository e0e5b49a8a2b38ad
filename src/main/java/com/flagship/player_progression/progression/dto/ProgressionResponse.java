package com.flagship.player_progression.progression.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.player_progression.progression.PlayerProgression;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class ProgressionResponse {

    @JsonProperty("player_id")
    Long playerId;

    @JsonProperty("level")
    int level;

    @JsonProperty("experience")
    long experience;

    @JsonProperty("xp_to_next_level")
    long experienceToNextLevel;

    @JsonProperty("prestige_level")
    int prestigeLevel;

    @JsonProperty("data_currency")
    long dataCurrency;

    @JsonProperty("total_matches_played")
    long totalMatchesPlayed;

    @JsonProperty("total_kills")
    long totalKills;

    @JsonProperty("total_deaths")
    long totalDeaths;

    @JsonProperty("total_waves_survived")
    long totalWavesSurvived;

    @JsonProperty("total_scrap_earned")
    long totalScrapEarned;

    @JsonProperty("total_data_earned")
    long totalDataEarned;

    @JsonProperty("updated_at")
    Instant updatedAt;

    public static ProgressionResponse from(PlayerProgression progression, long experienceToNextLevel) {
        return ProgressionResponse.builder()
                .playerId(progression.getPlayerId())
                .level(progression.getLevel())
                .experience(progression.getExperience())
                .experienceToNextLevel(experienceToNextLevel)
                .prestigeLevel(progression.getPrestigeLevel())
                .dataCurrency(progression.getCurrencyBalance())
                .totalMatchesPlayed(progression.getTotalMatchesPlayed())
                .totalKills(progression.getTotalKills())
                .totalDeaths(progression.getTotalDeaths())
                .totalWavesSurvived(progression.getTotalWavesSurvived())
                .totalScrapEarned(progression.getTotalScrapEarned())
                .totalDataEarned(progression.getTotalCurrencyEarned())
                .updatedAt(progression.getUpdatedAt())
                .build();
    }
}

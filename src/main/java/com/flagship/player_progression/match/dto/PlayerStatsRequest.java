package com.flagship.player_progression.match.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.player_progression.match.PlayerMatchStats;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Value;

@Value
public class PlayerStatsRequest {

    @NotNull(message = "player_id is required")
    @Positive(message = "player_id must be positive")
    @JsonProperty("player_id")
    Long playerId;

    @NotNull(message = "kills is required")
    @PositiveOrZero(message = "kills must not be negative")
    @Max(value = PlayerMatchStats.MAX_PER_MATCH, message = "kills must be at most 1000000000")
    @JsonProperty("kills")
    Long kills;

    @NotNull(message = "deaths is required")
    @PositiveOrZero(message = "deaths must not be negative")
    @Max(value = PlayerMatchStats.MAX_PER_MATCH, message = "deaths must be at most 1000000000")
    @JsonProperty("deaths")
    Long deaths;

    @NotNull(message = "waves_survived is required")
    @PositiveOrZero(message = "waves_survived must not be negative")
    @Max(value = PlayerMatchStats.MAX_PER_MATCH, message = "waves_survived must be at most 1000000000")
    @JsonProperty("waves_survived")
    Long wavesSurvived;

    @NotNull(message = "scrap_earned is required")
    @PositiveOrZero(message = "scrap_earned must not be negative")
    @Max(value = PlayerMatchStats.MAX_PER_MATCH, message = "scrap_earned must be at most 1000000000")
    @JsonProperty("scrap_earned")
    Long scrapEarned;

    @NotNull(message = "data_earned is required")
    @PositiveOrZero(message = "data_earned must not be negative")
    @Max(value = PlayerMatchStats.MAX_PER_MATCH, message = "data_earned must be at most 1000000000")
    @JsonProperty("data_earned")
    Long dataEarned;

    public PlayerMatchStats toStats() {
        return PlayerMatchStats.builder()
                .playerId(playerId)
                .kills(kills)
                .deaths(deaths)
                .wavesSurvived(wavesSurvived)
                .scrapEarned(scrapEarned)
                .dataEarned(dataEarned)
                .build();
    }
}

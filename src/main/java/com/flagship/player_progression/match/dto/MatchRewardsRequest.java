package com.flagship.player_progression.match.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.util.List;

/**
 * Result report sent by a game server when a match ends. Map, mode and
 * outcome are informational and only logged.
 */
@Value
public class MatchRewardsRequest {

    @Size(max = 64, message = "server_id must be at most 64 characters")
    @JsonProperty("server_id")
    String serverId;

    @JsonProperty("map_name")
    String mapName;

    @JsonProperty("game_mode")
    String gameMode;

    @JsonProperty("outcome")
    String outcome;

    @NotEmpty(message = "player_stats must not be empty")
    @Valid
    @JsonProperty("player_stats")
    List<PlayerStatsRequest> playerStats;
}

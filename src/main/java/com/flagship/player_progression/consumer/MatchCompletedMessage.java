package com.flagship.player_progression.consumer;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.player_progression.match.dto.PlayerStatsRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.util.List;
import java.util.UUID;

/**
 * Payload on the match-results topic. Player lines use the same shape as
 * the REST submission.
 */
@Value
public class MatchCompletedMessage {

    public static final String EVENT_TYPE = "MatchCompleted";

    @NotNull
    @JsonProperty("event_id")
    UUID eventId;

    @NotBlank
    @Size(max = 64)
    @JsonProperty("match_id")
    String matchId;

    @Size(max = 64)
    @JsonProperty("server_id")
    String serverId;

    @JsonProperty("map_name")
    String mapName;

    @JsonProperty("game_mode")
    String gameMode;

    @JsonProperty("outcome")
    String outcome;

    @NotEmpty
    @Valid
    @JsonProperty("player_stats")
    List<PlayerStatsRequest> playerStats;
}

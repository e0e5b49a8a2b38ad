package com.flagship.player_progression.match.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.player_progression.match.MatchAwardOutcome;
import lombok.Value;

import java.util.List;

@Value
public class MatchRewardsResponse {

    @JsonProperty("match_id")
    String matchId;

    @JsonProperty("duplicate")
    boolean duplicate;

    @JsonProperty("results")
    List<PlayerRewardResponse> results;

    public static MatchRewardsResponse from(MatchAwardOutcome outcome) {
        return new MatchRewardsResponse(
            outcome.getMatchId(),
            outcome.isDuplicate(),
            outcome.getResults().stream().map(PlayerRewardResponse::from).toList()
        );
    }
}

package com.flagship.player_progression.match;

import lombok.Value;

import java.util.Collections;
import java.util.List;

@Value
public class MatchAwardOutcome {
    String matchId;
    boolean duplicate;
    List<MatchRewardResult> results;

    static MatchAwardOutcome awarded(String matchId, List<MatchRewardResult> results) {
        return new MatchAwardOutcome(matchId, false, List.copyOf(results));
    }

    static MatchAwardOutcome duplicate(String matchId) {
        return new MatchAwardOutcome(matchId, true, Collections.emptyList());
    }
}

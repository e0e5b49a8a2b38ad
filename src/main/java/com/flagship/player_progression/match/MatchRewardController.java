package com.flagship.player_progression.match;

import com.flagship.player_progression.match.dto.MatchRewardsRequest;
import com.flagship.player_progression.match.dto.MatchRewardsResponse;
import com.flagship.player_progression.match.dto.PlayerStatsRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Game servers report finished matches here. Re-posting a match returns
 * 200 with {@code duplicate=true}.
 */
@RestController
@RequestMapping("/api/matches")
@Validated
@RequiredArgsConstructor
@Slf4j
public class MatchRewardController {

    private final MatchRewardService matchRewardService;

    @PostMapping("/{matchId}/rewards")
    public MatchRewardsResponse awardRewards(@PathVariable("matchId") @NotBlank @Size(max = 64) String matchId,
                                             @Valid @RequestBody MatchRewardsRequest request) {
        log.info("Match result received: matchId={}, serverId={}, map={}, mode={}, outcome={}, players={}",
                matchId, request.getServerId(), request.getMapName(), request.getGameMode(),
                request.getOutcome(), request.getPlayerStats().size());

        List<PlayerMatchStats> players = request.getPlayerStats().stream()
                .map(PlayerStatsRequest::toStats)
                .toList();
        return MatchRewardsResponse.from(matchRewardService.awardMatch(matchId, request.getServerId(), players));
    }
}

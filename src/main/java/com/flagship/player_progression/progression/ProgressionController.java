package com.flagship.player_progression.progression;

import com.flagship.player_progression.progression.dto.PrestigeResponse;
import com.flagship.player_progression.progression.dto.ProgressionResponse;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/players/{playerId}")
@Validated
@RequiredArgsConstructor
public class ProgressionController {

    private final ProgressionService progressionService;
    private final PrestigeService prestigeService;

    @GetMapping("/progression")
    public ProgressionResponse getProgression(@PathVariable("playerId") @Positive Long playerId) {
        PlayerProgression progression = progressionService.getProgression(playerId);
        return ProgressionResponse.from(progression, progressionService.experienceToNextLevel(progression));
    }

    /**
     * Not idempotent: every call advances the tier. Only call on an explicit player action.
     */
    @PostMapping("/prestige")
    public PrestigeResponse prestige(@PathVariable("playerId") @Positive Long playerId) {
        return PrestigeResponse.from(prestigeService.prestigePlayer(playerId));
    }
}

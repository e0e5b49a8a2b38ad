package com.flagship.player_progression.loot;

import com.flagship.player_progression.loot.dto.LootDropResponse;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/players/{playerId}/loot-drops")
@Validated
@RequiredArgsConstructor
public class LootController {

    private final LootDropService lootDropService;

    /**
     * 200 with the rolled cosmetic, 404 when no table fired this time,
     * 503 when the tables are misconfigured.
     */
    @PostMapping
    public LootDropResponse drop(@PathVariable("playerId") @Positive Long playerId) {
        return LootDropResponse.from(lootDropService.generateLootDrop(playerId));
    }
}

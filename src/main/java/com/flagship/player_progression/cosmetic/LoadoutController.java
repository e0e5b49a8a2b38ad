package com.flagship.player_progression.cosmetic;

import com.flagship.player_progression.cosmetic.dto.CreateLoadoutRequest;
import com.flagship.player_progression.cosmetic.dto.LoadoutResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/players/{playerId}/loadouts")
@Validated
@RequiredArgsConstructor
public class LoadoutController {

    private final LoadoutService loadoutService;

    @GetMapping
    public List<LoadoutResponse> list(@PathVariable("playerId") @Positive Long playerId) {
        return loadoutService.listLoadouts(playerId).stream()
                .map(LoadoutResponse::from)
                .toList();
    }

    @GetMapping("/active")
    public ResponseEntity<LoadoutResponse> getActive(@PathVariable("playerId") @Positive Long playerId) {
        return loadoutService.getActiveLoadout(playerId)
                .map(loadout -> ResponseEntity.ok(LoadoutResponse.from(loadout)))
                .orElse(ResponseEntity.notFound().build());
    }

    @PostMapping
    public ResponseEntity<LoadoutResponse> create(@PathVariable("playerId") @Positive Long playerId,
                                                  @Valid @RequestBody CreateLoadoutRequest request) {
        Loadout loadout = loadoutService.createLoadout(playerId, request.getName().trim());
        return ResponseEntity.status(HttpStatus.CREATED).body(LoadoutResponse.from(loadout));
    }

    @PostMapping("/{loadoutId}/activate")
    public LoadoutResponse activate(@PathVariable("playerId") @Positive Long playerId,
                                    @PathVariable("loadoutId") @Positive Long loadoutId) {
        return LoadoutResponse.from(loadoutService.activateLoadout(playerId, loadoutId));
    }
}

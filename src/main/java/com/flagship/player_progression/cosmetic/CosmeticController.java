package com.flagship.player_progression.cosmetic;

import com.flagship.player_progression.cosmetic.dto.CosmeticIdRequest;
import com.flagship.player_progression.cosmetic.dto.CosmeticResponse;
import com.flagship.player_progression.cosmetic.dto.OwnedCosmeticResponse;
import com.flagship.player_progression.cosmetic.dto.PurchaseResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Catalog, ownership, purchase and equip endpoints.
 *
 * Errors: unknown cosmetic 404, not owned 403, already owned 409,
 * insufficient currency 402 (see GlobalExceptionHandler).
 */
@RestController
@RequestMapping("/api")
@Validated
@RequiredArgsConstructor
public class CosmeticController {

    private final CosmeticService cosmeticService;
    private final LoadoutService loadoutService;

    @GetMapping("/cosmetics/catalog")
    public List<CosmeticResponse> getCatalog() {
        return cosmeticService.getCatalog().stream()
                .map(CosmeticResponse::from)
                .toList();
    }

    @GetMapping("/players/{playerId}/cosmetics")
    public List<OwnedCosmeticResponse> getOwned(@PathVariable("playerId") @Positive Long playerId) {
        return cosmeticService.getOwnedCosmetics(playerId).stream()
                .map(OwnedCosmeticResponse::from)
                .toList();
    }

    @PostMapping("/players/{playerId}/cosmetics/purchase")
    public PurchaseResponse purchase(@PathVariable("playerId") @Positive Long playerId,
                                     @Valid @RequestBody CosmeticIdRequest request) {
        return PurchaseResponse.from(cosmeticService.purchaseCosmetic(playerId, request.getCosmeticId()));
    }

    @PutMapping("/players/{playerId}/cosmetics/equip")
    public ResponseEntity<Void> equip(@PathVariable("playerId") @Positive Long playerId,
                                      @Valid @RequestBody CosmeticIdRequest request) {
        loadoutService.equipCosmetic(playerId, request.getCosmeticId());
        return ResponseEntity.noContent().build();
    }
}

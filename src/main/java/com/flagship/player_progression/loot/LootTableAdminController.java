package com.flagship.player_progression.loot;

import com.flagship.player_progression.cosmetic.CosmeticCatalog;
import com.flagship.player_progression.cosmetic.CosmeticItem;
import com.flagship.player_progression.cosmetic.dto.CosmeticResponse;
import com.flagship.player_progression.loot.dto.LootTableEntryRequest;
import com.flagship.player_progression.loot.dto.LootTableEntryResponse;
import com.flagship.player_progression.loot.dto.LootTableRequest;
import com.flagship.player_progression.loot.dto.LootTableResponse;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/admin/loot-tables")
@Validated
@RequiredArgsConstructor
public class LootTableAdminController {

    private final LootTableAdminService adminService;
    private final CosmeticCatalog catalog;

    @GetMapping
    public List<LootTableResponse> listTables() {
        return adminService.listTables().stream()
                .map(LootTableResponse::from)
                .toList();
    }

    @GetMapping("/{lootTableId}")
    public LootTableResponse getTable(@PathVariable("lootTableId") @Positive Long lootTableId) {
        return LootTableResponse.from(adminService.getTable(lootTableId));
    }

    @PostMapping
    public ResponseEntity<LootTableResponse> createTable(@Valid @RequestBody LootTableRequest request) {
        LootTable table = adminService.createTable(request.getName(), request.getDescription(),
                request.getDropChance(), request.isActiveOrDefault());
        return ResponseEntity.status(HttpStatus.CREATED).body(LootTableResponse.from(table));
    }

    @PutMapping("/{lootTableId}")
    public LootTableResponse updateTable(@PathVariable("lootTableId") @Positive Long lootTableId,
                                         @Valid @RequestBody LootTableRequest request) {
        return LootTableResponse.from(adminService.updateTable(lootTableId, request.getName(),
                request.getDescription(), request.getDropChance(), request.isActiveOrDefault()));
    }

    @DeleteMapping("/{lootTableId}")
    public ResponseEntity<Void> deleteTable(@PathVariable("lootTableId") @Positive Long lootTableId) {
        adminService.deleteTable(lootTableId);
        return ResponseEntity.noContent().build();
    }

    /**
     * Entries with their cosmetic's catalog record inlined.
     */
    @GetMapping("/{lootTableId}/entries")
    public List<LootTableEntryResponse> listEntries(@PathVariable("lootTableId") @Positive Long lootTableId) {
        List<LootTableEntry> entries = adminService.listEntries(lootTableId);
        Map<Long, CosmeticItem> cosmetics = catalog.findAll().stream()
                .collect(Collectors.toMap(CosmeticItem::getCosmeticId, Function.identity()));
        return entries.stream()
                .map(entry -> {
                    CosmeticItem item = cosmetics.get(entry.getCosmeticId());
                    return LootTableEntryResponse.from(entry, item == null ? null : CosmeticResponse.from(item));
                })
                .toList();
    }

    @GetMapping("/{lootTableId}/entries/{entryId}")
    public LootTableEntryResponse getEntry(@PathVariable("lootTableId") @Positive Long lootTableId,
                                           @PathVariable("entryId") @Positive Long entryId) {
        return LootTableEntryResponse.from(adminService.getEntry(lootTableId, entryId), null);
    }

    @PostMapping("/{lootTableId}/entries")
    public ResponseEntity<LootTableEntryResponse> addEntry(@PathVariable("lootTableId") @Positive Long lootTableId,
                                                           @Valid @RequestBody LootTableEntryRequest request) {
        LootTableEntry entry = adminService.addEntry(lootTableId, request.getCosmeticId(), request.getWeight(),
                request.minQuantityOrDefault(), request.maxQuantityOrDefault());
        return ResponseEntity.status(HttpStatus.CREATED).body(LootTableEntryResponse.from(entry, null));
    }

    @PutMapping("/{lootTableId}/entries/{entryId}")
    public LootTableEntryResponse updateEntry(@PathVariable("lootTableId") @Positive Long lootTableId,
                                              @PathVariable("entryId") @Positive Long entryId,
                                              @Valid @RequestBody LootTableEntryRequest request) {
        return LootTableEntryResponse.from(adminService.updateEntry(lootTableId, entryId, request.getCosmeticId(),
                request.getWeight(), request.minQuantityOrDefault(), request.maxQuantityOrDefault()), null);
    }

    @DeleteMapping("/{lootTableId}/entries/{entryId}")
    public ResponseEntity<Void> deleteEntry(@PathVariable("lootTableId") @Positive Long lootTableId,
                                            @PathVariable("entryId") @Positive Long entryId) {
        adminService.deleteEntry(lootTableId, entryId);
        return ResponseEntity.noContent().build();
    }
}

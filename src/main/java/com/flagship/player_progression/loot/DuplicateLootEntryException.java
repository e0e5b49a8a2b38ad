package com.flagship.player_progression.loot;

import com.flagship.player_progression.exception.ErrorKind;
import com.flagship.player_progression.exception.ProgressionException;
import lombok.Getter;

/**
 * A loot table lists each cosmetic at most once.
 */
@Getter
public class DuplicateLootEntryException extends ProgressionException {

    private final Long lootTableId;
    private final Long cosmeticId;

    public DuplicateLootEntryException(Long lootTableId, Long cosmeticId) {
        super(ErrorKind.CONFLICT, "Cosmetic " + cosmeticId + " is already in loot table " + lootTableId);
        this.lootTableId = lootTableId;
        this.cosmeticId = cosmeticId;
    }
}

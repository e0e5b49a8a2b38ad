package com.flagship.player_progression.loot;

import com.flagship.player_progression.exception.ErrorKind;
import com.flagship.player_progression.exception.ProgressionException;
import lombok.Getter;

@Getter
public class LootTableNotFoundException extends ProgressionException {

    private final Long lootTableId;

    public LootTableNotFoundException(Long lootTableId) {
        super(ErrorKind.NOT_FOUND, "Loot table not found: " + lootTableId);
        this.lootTableId = lootTableId;
    }
}

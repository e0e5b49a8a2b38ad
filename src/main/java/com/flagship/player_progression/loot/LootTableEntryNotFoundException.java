package com.flagship.player_progression.loot;

import com.flagship.player_progression.exception.ErrorKind;
import com.flagship.player_progression.exception.ProgressionException;
import lombok.Getter;

@Getter
public class LootTableEntryNotFoundException extends ProgressionException {

    private final Long entryId;

    public LootTableEntryNotFoundException(Long entryId) {
        super(ErrorKind.NOT_FOUND, "Loot table entry not found: " + entryId);
        this.entryId = entryId;
    }
}

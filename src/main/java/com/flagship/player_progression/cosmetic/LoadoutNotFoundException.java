package com.flagship.player_progression.cosmetic;

import com.flagship.player_progression.exception.ErrorKind;
import com.flagship.player_progression.exception.ProgressionException;
import lombok.Getter;

@Getter
public class LoadoutNotFoundException extends ProgressionException {

    private final Long loadoutId;

    public LoadoutNotFoundException(Long loadoutId) {
        super(ErrorKind.NOT_FOUND, "Loadout not found: " + loadoutId);
        this.loadoutId = loadoutId;
    }
}

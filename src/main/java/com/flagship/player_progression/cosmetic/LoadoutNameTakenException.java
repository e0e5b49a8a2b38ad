package com.flagship.player_progression.cosmetic;

import com.flagship.player_progression.exception.ErrorKind;
import com.flagship.player_progression.exception.ProgressionException;
import lombok.Getter;

@Getter
public class LoadoutNameTakenException extends ProgressionException {

    private final Long playerId;
    private final String name;

    public LoadoutNameTakenException(Long playerId, String name) {
        super(ErrorKind.CONFLICT, "Loadout name already in use: " + name);
        this.playerId = playerId;
        this.name = name;
    }
}

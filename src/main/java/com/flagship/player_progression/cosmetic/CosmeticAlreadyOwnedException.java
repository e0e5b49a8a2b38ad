package com.flagship.player_progression.cosmetic;

import com.flagship.player_progression.exception.ErrorKind;
import com.flagship.player_progression.exception.ProgressionException;
import lombok.Getter;

@Getter
public class CosmeticAlreadyOwnedException extends ProgressionException {

    private final Long playerId;
    private final Long cosmeticId;

    public CosmeticAlreadyOwnedException(Long playerId, Long cosmeticId) {
        super(ErrorKind.ALREADY_OWNED, "Cosmetic " + cosmeticId + " is already owned");
        this.playerId = playerId;
        this.cosmeticId = cosmeticId;
    }
}

package com.flagship.player_progression.cosmetic;

import com.flagship.player_progression.exception.ErrorKind;
import com.flagship.player_progression.exception.ProgressionException;
import lombok.Getter;

@Getter
public class CosmeticNotOwnedException extends ProgressionException {

    private final Long playerId;
    private final Long cosmeticId;

    public CosmeticNotOwnedException(Long playerId, Long cosmeticId) {
        super(ErrorKind.NOT_OWNED, "Cosmetic " + cosmeticId + " is not owned");
        this.playerId = playerId;
        this.cosmeticId = cosmeticId;
    }
}

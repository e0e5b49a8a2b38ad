package com.flagship.player_progression.cosmetic;

import com.flagship.player_progression.exception.ErrorKind;
import com.flagship.player_progression.exception.ProgressionException;
import lombok.Getter;

@Getter
public class CosmeticNotFoundException extends ProgressionException {

    private final Long cosmeticId;

    public CosmeticNotFoundException(Long cosmeticId) {
        super(ErrorKind.NOT_FOUND, "Cosmetic not found: " + cosmeticId);
        this.cosmeticId = cosmeticId;
    }
}

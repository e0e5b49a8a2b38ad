package com.flagship.player_progression.loot;

import com.flagship.player_progression.exception.ErrorKind;
import com.flagship.player_progression.exception.ProgressionException;
import lombok.Getter;

/**
 * The configured loot tables cannot produce a drop.
 */
@Getter
public class LootConfigurationException extends ProgressionException {

    public enum Reason {
        NO_ACTIVE_LOOT_TABLES,
        /** Every table's drop roll missed. Not a misconfiguration as such, just no drop this time. */
        NO_DROP_FROM_ANY_TABLE,
        EMPTY_LOOT_TABLE,
        NON_POSITIVE_WEIGHT
    }

    private final Reason reason;

    public LootConfigurationException(Reason reason, String message) {
        super(ErrorKind.LOOT_CONFIGURATION, message);
        this.reason = reason;
    }
}

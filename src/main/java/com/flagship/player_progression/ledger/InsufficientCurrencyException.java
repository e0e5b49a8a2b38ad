package com.flagship.player_progression.ledger;

import com.flagship.player_progression.exception.ErrorKind;
import com.flagship.player_progression.exception.ProgressionException;
import lombok.Getter;

@Getter
public class InsufficientCurrencyException extends ProgressionException {

    private final Long playerId;
    private final long required;
    private final long balance;

    public InsufficientCurrencyException(Long playerId, long required, long balance) {
        super(ErrorKind.INSUFFICIENT_CURRENCY,
                String.format("Insufficient currency: required %d, balance %d", required, balance));
        this.playerId = playerId;
        this.required = required;
        this.balance = balance;
    }
}

package com.flagship.player_progression.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Mirrors one appended currency transaction.
 */
@Value
public class CurrencyChangedEvent implements ProgressionEvent {
    UUID eventId;
    Long playerId;
    Long transactionId;
    long amount;
    long balanceAfter;
    String transactionType;
    String referenceId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "CurrencyChanged";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static CurrencyChangedEvent of(Long playerId, Long transactionId, long amount, long balanceAfter,
                                          String transactionType, String referenceId) {
        return new CurrencyChangedEvent(UUID.randomUUID(), playerId, transactionId, amount, balanceAfter,
                transactionType, referenceId, Instant.now());
    }
}

package com.flagship.player_progression.ledger;

import lombok.Value;

import java.time.Instant;

/**
 * Append-only ledger row. {@code balanceAfter} is the balance immediately
 * after this transaction, so replaying a player's rows in transactionId order
 * reproduces every intermediate balance.
 */
@Value
public class CurrencyTransaction {
    Long transactionId;
    Long playerId;
    long amount;
    long balanceAfter;
    TransactionKind kind;
    String referenceId;
    Instant createdAt;
}

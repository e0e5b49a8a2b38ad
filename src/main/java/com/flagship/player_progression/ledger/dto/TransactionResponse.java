package com.flagship.player_progression.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.player_progression.ledger.CurrencyTransaction;
import com.flagship.player_progression.ledger.TransactionKind;
import lombok.Value;

import java.time.Instant;

@Value
public class TransactionResponse {

    @JsonProperty("transaction_id")
    Long transactionId;

    @JsonProperty("player_id")
    Long playerId;

    @JsonProperty("amount")
    long amount;

    @JsonProperty("balance_after")
    long balanceAfter;

    @JsonProperty("transaction_type")
    TransactionKind transactionType;

    @JsonProperty("reference_id")
    String referenceId;

    @JsonProperty("created_at")
    Instant createdAt;

    public static TransactionResponse from(CurrencyTransaction transaction) {
        return new TransactionResponse(
            transaction.getTransactionId(),
            transaction.getPlayerId(),
            transaction.getAmount(),
            transaction.getBalanceAfter(),
            transaction.getKind(),
            transaction.getReferenceId(),
            transaction.getCreatedAt()
        );
    }
}

package com.flagship.player_progression.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.player_progression.ledger.TransactionKind;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

/**
 * Manual balance adjustment. A negative amount debits.
 */
@Value
public class CurrencyGrantRequest {

    public static final long MAX_ADJUSTMENT = 1_000_000_000L;

    @NotNull(message = "amount is required")
    @Min(value = -MAX_ADJUSTMENT, message = "amount must be at least -1000000000")
    @Max(value = MAX_ADJUSTMENT, message = "amount must be at most 1000000000")
    @JsonProperty("amount")
    Long amount;

    @NotNull(message = "transaction_type is required")
    @JsonProperty("transaction_type")
    TransactionKind transactionType;

    @Size(max = 64, message = "reference_id must be at most 64 characters")
    @JsonProperty("reference_id")
    String referenceId;
}

package com.flagship.player_progression.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

@Value
public class BalanceResponse {

    @JsonProperty("player_id")
    Long playerId;

    @JsonProperty("data_currency")
    long dataCurrency;
}

package com.flagship.player_progression.cosmetic.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.player_progression.cosmetic.PurchaseResult;
import lombok.Value;

@Value
public class PurchaseResponse {

    @JsonProperty("cosmetic")
    CosmeticResponse cosmetic;

    @JsonProperty("data_currency")
    long dataCurrency;

    public static PurchaseResponse from(PurchaseResult result) {
        return new PurchaseResponse(CosmeticResponse.from(result.getCosmetic()), result.getBalanceAfter());
    }
}

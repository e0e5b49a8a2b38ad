package com.flagship.player_progression.cosmetic;

import lombok.Value;

@Value
public class PurchaseResult {
    CosmeticItem cosmetic;
    long balanceAfter;
}

package com.flagship.player_progression.cosmetic;

import lombok.Value;

import java.time.Instant;

@Value
public class OwnedCosmetic {
    CosmeticItem item;
    Instant unlockedAt;
    UnlockMethod unlockedVia;
}

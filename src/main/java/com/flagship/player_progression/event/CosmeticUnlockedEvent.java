package com.flagship.player_progression.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published only when ownership was actually created, never for a duplicate grant.
 */
@Value
public class CosmeticUnlockedEvent implements ProgressionEvent {
    UUID eventId;
    Long playerId;
    Long cosmeticId;
    String unlockedVia;
    Instant occurredAt;

    public static final String EVENT_TYPE = "CosmeticUnlocked";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static CosmeticUnlockedEvent of(Long playerId, Long cosmeticId, String unlockedVia) {
        return new CosmeticUnlockedEvent(UUID.randomUUID(), playerId, cosmeticId, unlockedVia, Instant.now());
    }
}

package com.flagship.player_progression.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class PlayerLeveledUpEvent implements ProgressionEvent {
    UUID eventId;
    Long playerId;
    int previousLevel;
    int newLevel;
    long experience;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PlayerLeveledUp";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PlayerLeveledUpEvent of(Long playerId, int previousLevel, int newLevel, long experience) {
        return new PlayerLeveledUpEvent(UUID.randomUUID(), playerId, previousLevel, newLevel,
                experience, Instant.now());
    }
}

package com.flagship.player_progression.event;

import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
public class PlayerPrestigedEvent implements ProgressionEvent {
    UUID eventId;
    Long playerId;
    int prestigeLevel;
    List<Long> grantedCosmeticIds;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PlayerPrestiged";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PlayerPrestigedEvent of(Long playerId, int prestigeLevel, List<Long> grantedCosmeticIds) {
        return new PlayerPrestigedEvent(UUID.randomUUID(), playerId, prestigeLevel,
                List.copyOf(grantedCosmeticIds), Instant.now());
    }
}

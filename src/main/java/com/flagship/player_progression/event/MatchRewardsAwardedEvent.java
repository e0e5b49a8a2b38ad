package com.flagship.player_progression.event;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published once per player per rewarded match. matchId is null when the
 * reward was applied through the single-player operation.
 */
@Value
public class MatchRewardsAwardedEvent implements ProgressionEvent {
    UUID eventId;
    Long playerId;
    String matchId;
    long experienceAwarded;
    long currencyAwarded;
    long experience;
    int level;
    Instant occurredAt;

    public static final String EVENT_TYPE = "MatchRewardsAwarded";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static MatchRewardsAwardedEvent of(Long playerId, String matchId, long experienceAwarded,
                                              long currencyAwarded, long experience, int level) {
        return new MatchRewardsAwardedEvent(UUID.randomUUID(), playerId, matchId,
                experienceAwarded, currencyAwarded, experience, level, Instant.now());
    }
}

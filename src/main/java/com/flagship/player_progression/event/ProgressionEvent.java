package com.flagship.player_progression.event;

import java.time.Instant;
import java.util.UUID;

/**
 * A fact about a player's progression, published through the outbox.
 */
public interface ProgressionEvent {

    /**
     * Unique per event instance; consumers de-duplicate on it.
     */
    UUID getEventId();

    Long getPlayerId();

    Instant getOccurredAt();

    String getEventType();
}

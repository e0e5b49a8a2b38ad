package com.flagship.player_progression.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A progression fact waiting to be (or already) published to Kafka.
 *
 * Written in the same transaction as the state change it describes, so a
 * rolled back purchase or match reward never leaks an event.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // "Player"
    String aggregateId;        // player id, used as the Kafka key
    String eventType;          // e.g. "PlayerLeveledUp"
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null until published
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, String aggregateId,
                                     String eventType, String payload) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null,
            null   // assigned by the database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }
}

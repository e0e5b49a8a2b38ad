package com.flagship.player_progression.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.player_progression.event.ProgressionEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Writes progression events to the outbox inside the caller's transaction.
 *
 * If the business operation commits, the event is guaranteed to be stored;
 * if it rolls back, so does the event. Publishing to Kafka is done later by
 * {@link OutboxPublisher}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    public static final String PLAYER_AGGREGATE = "Player";

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;

    /**
     * Stores an event for the player it concerns. Fails with
     * IllegalTransactionStateException when called outside a transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(ProgressionEvent event) {
        String aggregateId = String.valueOf(event.getPlayerId());
        OutboxEvent outboxEvent = OutboxEvent.create(
                PLAYER_AGGREGATE, aggregateId, event.getEventType(), serializePayload(event));

        OutboxEventEntity saved = repository.save(OutboxEventEntity.fromDomain(outboxEvent));

        log.debug("Saved outbox event: type={}, playerId={}", event.getEventType(), aggregateId);
        return saved.toDomain();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findPublishableEvents(int maxRetries, int limit) {
        return repository.findPublishableForUpdate(maxRetries, limit)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished();
            repository.save(entity);
            log.debug("Marked event {} as published", eventId);
        });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID eventId, String errorMessage) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markFailed(errorMessage);
            repository.save(entity);
            log.warn("Marked event {} as failed (retry #{}): {}",
                    eventId, entity.getRetryCount(), errorMessage);
        });
    }

    /**
     * Events recorded for one player, in write order.
     */
    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForPlayer(Long playerId) {
        return repository.findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(
                PLAYER_AGGREGATE, String.valueOf(playerId))
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    private String serializePayload(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize event payload", e);
        }
    }
}

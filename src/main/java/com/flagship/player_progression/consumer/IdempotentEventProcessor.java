package com.flagship.player_progression.consumer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

/**
 * Runs an inbound message's handler at most once per consumer group.
 *
 * The handler and the processed_events record share one transaction. A
 * handler failure rolls both back, so the message is redelivered and
 * retried; a success is never applied twice.
 *
 * <pre>
 * eventProcessor.processEvent(eventId, "MatchCompleted", "Match", matchId, group,
 *         () -> matchRewardService.awardMatch(...));
 * </pre>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentEventProcessor {

    private final ProcessedEventRepository repository;

    /**
     * @return true if the handler ran, false if the event was already processed
     */
    @Transactional
    public boolean processEvent(UUID eventId, String eventType,
                                String aggregateType, String aggregateId,
                                String consumerGroup, Runnable handler) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            log.info("Event {} already processed by consumer group {}, skipping", eventId, consumerGroup);
            return false;
        }

        try {
            handler.run();
        } catch (RuntimeException e) {
            log.error("Failed to process event {} by consumer group {}: {}",
                    eventId, consumerGroup, e.getMessage(), e);
            throw e;
        }

        repository.save(ProcessedEventEntity.fromDomain(
                ProcessedEvent.success(eventId, eventType, aggregateType, aggregateId, consumerGroup)));
        log.debug("Processed event {} by consumer group {}", eventId, consumerGroup);
        return true;
    }

    /**
     * Records an event that will never be applied (unknown type, invalid
     * payload) so that redelivery does not re-evaluate it.
     */
    @Transactional
    public void skipEvent(UUID eventId, String eventType,
                          String aggregateType, String aggregateId,
                          String consumerGroup, String reason) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            return;
        }
        repository.save(ProcessedEventEntity.fromDomain(
                ProcessedEvent.skipped(eventId, eventType, aggregateType, aggregateId, consumerGroup, reason)));
        log.info("Skipped event {} by consumer group {}: {}", eventId, consumerGroup, reason);
    }

    public boolean isAlreadyProcessed(UUID eventId, String consumerGroup) {
        return repository.existsByEventIdAndConsumerGroup(eventId, consumerGroup);
    }

    public Optional<ProcessedEvent> findProcessed(UUID eventId, String consumerGroup) {
        return repository.findByEventIdAndConsumerGroup(eventId, consumerGroup)
                .map(ProcessedEventEntity::toDomain);
    }
}

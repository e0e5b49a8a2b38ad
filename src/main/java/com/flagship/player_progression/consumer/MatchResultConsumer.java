package com.flagship.player_progression.consumer;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.player_progression.match.InvalidMatchStatsException;
import com.flagship.player_progression.match.MatchRewardService;
import com.flagship.player_progression.match.PlayerMatchStats;
import com.flagship.player_progression.match.dto.PlayerStatsRequest;
import com.flagship.player_progression.observability.CorrelationContext;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;
import org.slf4j.MDC;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Applies match results published by game servers.
 *
 * Invalid payloads are recorded as skipped and acknowledged. Storage
 * failures are not acknowledged, so the message is redelivered; the
 * processed_events record and the match receipt keep the retry from
 * paying anyone twice.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class MatchResultConsumer {

    static final String CONSUMER_GROUP = "match-result-consumer";
    static final String AGGREGATE_TYPE = "Match";

    private final IdempotentEventProcessor eventProcessor;
    private final MatchRewardService matchRewardService;
    private final ObjectMapper objectMapper;
    private final Validator validator;

    @KafkaListener(
        topics = "${kafka.topic.match-results:match-results}",
        groupId = "${spring.kafka.consumer.group-id:player-progression-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received match result: partition={}, offset={}, key={}",
                record.partition(), record.offset(), record.key());

        String correlationId = headerValue(record, CorrelationContext.CORRELATION_ID_HEADER);
        CorrelationContext.setCorrelationId(correlationId);
        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, CorrelationContext.getCorrelationId());
        try {
            MatchCompletedMessage message = parse(record.value());
            if (message == null || message.getEventId() == null) {
                log.warn("Unparseable match result at offset {}, acknowledging to skip", record.offset());
                ack.acknowledge();
                return;
            }

            handle(message);
            ack.acknowledge();

        } catch (DataAccessException e) {
            log.error("Storage failure applying match result: offset={}, matchId={}, playerId={}, operation={}",
                    record.offset(), MDC.get(CorrelationContext.MATCH_ID_MDC_KEY),
                    MDC.get(CorrelationContext.PLAYER_ID_MDC_KEY), MDC.get(CorrelationContext.OPERATION_MDC_KEY), e);
            throw e;
        } finally {
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
            MDC.remove(CorrelationContext.MATCH_ID_MDC_KEY);
            CorrelationContext.clearPlayerScope();
            CorrelationContext.clear();
        }
    }

    /**
     * Validates and applies one message. Validation runs before the processing
     * transaction opens so a rejected message leaves nothing half-done.
     *
     * @return true if the match was applied by this call
     */
    boolean handle(MatchCompletedMessage message) {
        String aggregateId = message.getMatchId() == null ? "unknown" : message.getMatchId();

        String violation = validate(message);
        List<PlayerMatchStats> players = null;
        if (violation == null) {
            players = message.getPlayerStats().stream()
                    .map(PlayerStatsRequest::toStats)
                    .toList();
            try {
                matchRewardService.validateMatch(message.getMatchId(), players);
            } catch (InvalidMatchStatsException e) {
                violation = e.getMessage();
            }
        }

        if (violation != null) {
            log.warn("Rejecting match result {}: {}", message.getEventId(), violation);
            eventProcessor.skipEvent(message.getEventId(), MatchCompletedMessage.EVENT_TYPE,
                    AGGREGATE_TYPE, aggregateId, CONSUMER_GROUP, violation);
            return false;
        }

        List<PlayerMatchStats> validPlayers = players;
        boolean processed = eventProcessor.processEvent(message.getEventId(), MatchCompletedMessage.EVENT_TYPE,
                AGGREGATE_TYPE, aggregateId, CONSUMER_GROUP,
                () -> matchRewardService.awardMatch(message.getMatchId(), message.getServerId(), validPlayers));
        if (processed) {
            log.info("Applied match result: eventId={}, matchId={}, players={}",
                    message.getEventId(), message.getMatchId(), validPlayers.size());
        }
        return processed;
    }

    private String validate(MatchCompletedMessage message) {
        Set<ConstraintViolation<MatchCompletedMessage>> violations = validator.validate(message);
        if (violations.isEmpty()) {
            return null;
        }
        return violations.stream()
                .map(v -> v.getPropertyPath() + " " + v.getMessage())
                .sorted()
                .collect(Collectors.joining(", "));
    }

    private MatchCompletedMessage parse(String json) {
        try {
            return objectMapper.readValue(json, MatchCompletedMessage.class);
        } catch (JsonProcessingException e) {
            log.error("Failed to parse match result: {}", e.getOriginalMessage());
            return null;
        }
    }

    private String headerValue(ConsumerRecord<String, String> record, String name) {
        Header header = record.headers().lastHeader(name);
        return header == null ? null : new String(header.value(), StandardCharsets.UTF_8);
    }
}

package com.flagship.player_progression.consumer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.player_progression.match.MatchRewardService;
import com.flagship.player_progression.match.dto.PlayerStatsRequest;
import com.flagship.player_progression.progression.ProgressionService;
import jakarta.validation.Validator;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Inbound match results: validation, skip records and exactly-once application.
 */
@SpringBootTest
@Testcontainers
class MatchResultConsumerTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("player_progression_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
    }

    @Autowired
    private IdempotentEventProcessor eventProcessor;

    @Autowired
    private MatchRewardService matchRewardService;

    @Autowired
    private ProgressionService progressionService;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private Validator validator;

    private MatchResultConsumer consumer;

    @BeforeEach
    void setUp() {
        // The listener bean is disabled without a broker; drive it directly.
        consumer = new MatchResultConsumer(eventProcessor, matchRewardService, objectMapper, validator);
    }

    private static long newPlayerId() {
        return Math.abs(UUID.randomUUID().getMostSignificantBits() % 1_000_000_000L) + 1;
    }

    private static PlayerStatsRequest line(Long playerId, long kills) {
        return new PlayerStatsRequest(playerId, kills, 0L, 1L, 0L, 0L);
    }

    private static MatchCompletedMessage message(UUID eventId, String matchId, List<PlayerStatsRequest> players) {
        return new MatchCompletedMessage(eventId, matchId, "server-7", "Foundry", "survival", "victory", players);
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @Test
    @DisplayName("processEvent runs the handler once per event and consumer group")
    void testProcessEventOnce() {
        printTestHeader("Idempotent Processing");
        UUID eventId = UUID.randomUUID();
        AtomicInteger calls = new AtomicInteger();

        boolean first = eventProcessor.processEvent(eventId, "Test", "Match", "m-1", "group-a", calls::incrementAndGet);
        boolean second = eventProcessor.processEvent(eventId, "Test", "Match", "m-1", "group-a", calls::incrementAndGet);
        boolean otherGroup = eventProcessor.processEvent(eventId, "Test", "Match", "m-1", "group-b", calls::incrementAndGet);

        assertTrue(first);
        assertFalse(second);
        assertTrue(otherGroup);
        assertEquals(2, calls.get());
        assertEquals(ProcessedEvent.ProcessingResult.SUCCESS,
                eventProcessor.findProcessed(eventId, "group-a").orElseThrow().getResult());
        printSuccess("Handler ran once per group");
    }

    @Test
    @DisplayName("A failing handler leaves no processed record, so the event can be retried")
    void testFailedHandlerNotRecorded() {
        printTestHeader("Failed Handler");
        UUID eventId = UUID.randomUUID();

        assertThrows(IllegalStateException.class, () -> eventProcessor.processEvent(
                eventId, "Test", "Match", "m-2", "group-a", () -> {
                    throw new IllegalStateException("boom");
                }));

        assertFalse(eventProcessor.isAlreadyProcessed(eventId, "group-a"));
        printSuccess("Retry possible");
    }

    @Test
    @DisplayName("A valid match result is applied once even when redelivered")
    void testValidMessageAppliedOnce() {
        printTestHeader("Valid Match Result");
        long playerId = newPlayerId();
        MatchCompletedMessage msg = message(UUID.randomUUID(), "match-" + UUID.randomUUID(),
                List.of(line(playerId, 3)));

        assertTrue(consumer.handle(msg));
        assertFalse(consumer.handle(msg));

        // 100 base + 30 for kills + 50 for one wave
        assertEquals(180, progressionService.getProgression(playerId).getExperience());
        assertEquals(1, progressionService.getProgression(playerId).getTotalMatchesPlayed());
        printSuccess("Applied once");
    }

    @Test
    @DisplayName("The same match under a new event id is not paid twice")
    void testSameMatchNewEventId() {
        printTestHeader("Same Match, New Event");
        long playerId = newPlayerId();
        String matchId = "match-" + UUID.randomUUID();

        consumer.handle(message(UUID.randomUUID(), matchId, List.of(line(playerId, 1))));
        consumer.handle(message(UUID.randomUUID(), matchId, List.of(line(playerId, 1))));

        assertEquals(110 + 50, progressionService.getProgression(playerId).getExperience());
        printSuccess("Match receipt prevented a second payout");
    }

    @Test
    @DisplayName("Invalid match results are recorded as skipped and change nothing")
    void testInvalidMessagesSkipped() {
        printTestHeader("Invalid Match Results");
        long playerId = newPlayerId();
        UUID negativeKills = UUID.randomUUID();
        UUID noPlayers = UUID.randomUUID();
        UUID duplicatePlayer = UUID.randomUUID();

        assertFalse(consumer.handle(message(negativeKills, "match-" + UUID.randomUUID(),
                List.of(line(playerId, -4)))));
        assertFalse(consumer.handle(message(noPlayers, "match-" + UUID.randomUUID(), List.of())));
        assertFalse(consumer.handle(message(duplicatePlayer, "match-" + UUID.randomUUID(),
                List.of(line(playerId, 1), line(playerId, 2)))));

        for (UUID eventId : List.of(negativeKills, noPlayers, duplicatePlayer)) {
            ProcessedEvent record = eventProcessor
                    .findProcessed(eventId, MatchResultConsumer.CONSUMER_GROUP).orElseThrow();
            assertEquals(ProcessedEvent.ProcessingResult.SKIPPED, record.getResult());
            assertNotNull(record.getErrorMessage());
        }
        assertEquals(0, progressionService.getProgression(playerId).getExperience());
        printSuccess("All three skipped");
    }

    @Test
    @DisplayName("Unparseable records are acknowledged and dropped")
    void testUnparseableRecordAcknowledged() {
        printTestHeader("Unparseable Record");
        AtomicInteger acks = new AtomicInteger();

        consumer.consume(new ConsumerRecord<>("match-results", 0, 0L, "key", "{not json"),
                acks::incrementAndGet);

        assertEquals(1, acks.get());
        printSuccess("Acknowledged");
    }

    @Test
    @DisplayName("A JSON record is parsed and applied through the listener entry point")
    void testConsumeJsonRecord() throws Exception {
        printTestHeader("Consume JSON Record");
        long playerId = newPlayerId();
        MatchCompletedMessage msg = message(UUID.randomUUID(), "match-" + UUID.randomUUID(),
                List.of(line(playerId, 0)));
        String json = objectMapper.writeValueAsString(msg);
        AtomicInteger acks = new AtomicInteger();

        consumer.consume(new ConsumerRecord<>("match-results", 0, 1L, msg.getMatchId(), json),
                acks::incrementAndGet);

        assertEquals(1, acks.get());
        assertEquals(150, progressionService.getProgression(playerId).getExperience());
        assertTrue(eventProcessor.isAlreadyProcessed(msg.getEventId(), MatchResultConsumer.CONSUMER_GROUP));
        printSuccess("Applied from JSON");
    }
}

package com.flagship.player_progression.outbox;

import com.flagship.player_progression.ledger.CurrencyLedgerService;
import com.flagship.player_progression.ledger.TransactionKind;
import com.flagship.player_progression.match.MatchRewardService;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.KafkaContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox publishing against a real broker.
 */
@SpringBootTest
@Testcontainers
class OutboxPublisherTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("player_progression_test")
            .withUsername("test")
            .withPassword("test");

    @Container
    static KafkaContainer kafka = new KafkaContainer(
            DockerImageName.parse("confluentinc/cp-kafka:7.5.0"));

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", kafka::getBootstrapServers);
        registry.add("consumer.enabled", () -> "false");
        // The publisher bean must exist; keep the schedule out of the way and trigger manually
        registry.add("outbox.publisher.enabled", () -> "true");
        registry.add("outbox.publisher.poll-interval-ms", () -> "3600000");
    }

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private OutboxPublisher outboxPublisher;

    @Autowired
    private MatchRewardService matchRewardService;

    @Autowired
    private CurrencyLedgerService ledgerService;

    @Value("${kafka.topic.progression-events:progression-events}")
    private String progressionEventsTopic;

    private KafkaConsumer<String, String> consumer;

    @BeforeEach
    void setUp() {
        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers());
        props.put(ConsumerConfig.GROUP_ID_CONFIG, "test-group-" + UUID.randomUUID());
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "true");

        consumer = new KafkaConsumer<>(props);
        consumer.subscribe(Collections.singletonList(progressionEventsTopic));

        System.out.println("\n--- Test Setup ---");
        System.out.println("Kafka bootstrap servers: " + kafka.getBootstrapServers());
        System.out.println("Topic: " + progressionEventsTopic);
    }

    @AfterEach
    void tearDown() {
        consumer.close();
    }

    private static long newPlayerId() {
        return Math.abs(UUID.randomUUID().getMostSignificantBits() % 1_000_000_000L) + 1;
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
    @DisplayName("Published events are keyed by player id, in order, and marked published")
    void testPublishesKeyedByPlayer() {
        printTestHeader("Publisher Sends Player Events");
        long playerId = newPlayerId();

        // 100 base + 1000 scrap crosses into level 2; 30 data credited
        matchRewardService.awardMatchRewards(playerId, 0, 0, 0, 1000, 30);
        int expected = outboxService.getEventsForPlayer(playerId).size();
        assertTrue(expected >= 3, "level-up, currency and match events expected");

        outboxPublisher.triggerPublish();

        assertTrue(outboxService.getEventsForPlayer(playerId).stream().allMatch(OutboxEvent::isPublished));

        List<ConsumerRecord<String, String>> records = consumeRecordsFor(String.valueOf(playerId), expected, 10000);
        System.out.println("Records received: " + records.size());
        assertEquals(expected, records.size());

        List<String> publishedTypes = records.stream().map(ConsumerRecord::value).toList();
        List<OutboxEvent> stored = outboxService.getEventsForPlayer(playerId);
        for (int i = 0; i < expected; i++) {
            assertTrue(publishedTypes.get(i).contains(stored.get(i).getEventType()),
                    "record " + i + " should carry " + stored.get(i).getEventType());
        }
        assertEquals(1, records.stream().map(ConsumerRecord::partition).distinct().count());
        printSuccess("Events delivered in write order on one partition");
    }

    @Test
    @DisplayName("Nothing is left unpublished after a publish run")
    void testUnpublishedCountDrains() {
        printTestHeader("Unpublished Count Drains");

        for (int i = 0; i < 5; i++) {
            ledgerService.adjustBalance(newPlayerId(), 10, TransactionKind.ADMIN_GRANT, null);
        }
        assertTrue(outboxService.countUnpublished() >= 5);

        outboxPublisher.triggerPublish();

        assertEquals(0, outboxService.countUnpublished());
        printSuccess("Outbox drained");
    }

    private List<ConsumerRecord<String, String>> consumeRecordsFor(String key, int expected, long timeoutMs) {
        List<ConsumerRecord<String, String>> matching = new ArrayList<>();
        long endTime = System.currentTimeMillis() + timeoutMs;

        while (System.currentTimeMillis() < endTime && matching.size() < expected) {
            ConsumerRecords<String, String> records = consumer.poll(Duration.ofMillis(100));
            for (ConsumerRecord<String, String> record : records) {
                if (key.equals(record.key())) {
                    matching.add(record);
                }
            }
        }
        return matching;
    }
}

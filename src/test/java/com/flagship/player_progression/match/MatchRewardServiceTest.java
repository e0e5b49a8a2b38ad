package com.flagship.player_progression.match;

import com.flagship.player_progression.event.MatchRewardsAwardedEvent;
import com.flagship.player_progression.event.PlayerLeveledUpEvent;
import com.flagship.player_progression.ledger.CurrencyLedgerService;
import com.flagship.player_progression.ledger.CurrencyTransaction;
import com.flagship.player_progression.ledger.TransactionKind;
import com.flagship.player_progression.outbox.OutboxEvent;
import com.flagship.player_progression.outbox.OutboxService;
import com.flagship.player_progression.progression.PlayerProgression;
import com.flagship.player_progression.progression.ProgressionService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Match rewards: experience formula, level-ups, currency credit and
 * whole-match idempotency and atomicity.
 */
@SpringBootTest
@Testcontainers
class MatchRewardServiceTest {

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
    private MatchRewardService matchRewardService;

    @Autowired
    private ProgressionService progressionService;

    @Autowired
    private CurrencyLedgerService ledgerService;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private MatchRewardReceiptRepository receiptRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private static long newPlayerId() {
        return Math.abs(UUID.randomUUID().getMostSignificantBits() % 1_000_000_000L) + 1;
    }

    private static String newMatchId() {
        return "match-" + UUID.randomUUID();
    }

    private static PlayerMatchStats stats(long playerId, long kills, long waves, long scrap, long data) {
        return PlayerMatchStats.builder()
                .playerId(playerId)
                .kills(kills)
                .deaths(1)
                .wavesSurvived(waves)
                .scrapEarned(scrap)
                .dataEarned(data)
                .build();
    }

    private boolean progressionExists(long playerId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM player_progression WHERE player_id = ?", Integer.class, playerId);
        return count != null && count > 0;
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @Test
    @DisplayName("950 xp plus a one-kill match (110 xp) ends at 1060 xp and level 2")
    void testLevelUpScenario() {
        printTestHeader("Level-Up Scenario");
        long playerId = newPlayerId();
        Long levelTwoBadge = jdbcTemplate.queryForObject(
                "INSERT INTO cosmetic_items (name, slot, unlock_level, data_cost) " +
                "VALUES ('Level Two Badge', 'badge', 2, 0) RETURNING cosmetic_id", Long.class);

        // Given: 100 base + 850 scrap = 950
        MatchRewardResult first = matchRewardService.awardMatchRewards(playerId, 0, 0, 0, 850, 0);
        assertEquals(950, first.getExperience());
        assertEquals(1, first.getLevel());

        // When: 100 base + 10 for one kill
        printInput("Stats", "kills=1, waves=0, scrap=0");
        MatchRewardResult result = matchRewardService.awardMatchRewards(playerId, 1, 0, 0, 0, 0);
        printOutput("Result", result);

        // Then
        assertEquals(110, result.getExperienceAwarded());
        assertEquals(1060, result.getExperience());
        assertEquals(2, result.getLevel());
        assertTrue(result.isLeveledUp());
        assertTrue(result.getUnlockedCosmeticIds().contains(levelTwoBadge));

        PlayerProgression progression = progressionService.getProgression(playerId);
        assertEquals(2, progression.getLevel());
        assertEquals(1060, progression.getExperience());
        assertEquals(2, progression.getTotalMatchesPlayed());
        assertEquals(1, progression.getTotalKills());
        assertEquals(850, progression.getTotalScrapEarned());
        assertEquals(940, progressionService.experienceToNextLevel(progression));

        List<OutboxEvent> events = outboxService.getEventsForPlayer(playerId);
        assertEquals(1, events.stream()
                .filter(e -> PlayerLeveledUpEvent.EVENT_TYPE.equals(e.getEventType())).count());
        assertEquals(2, events.stream()
                .filter(e -> MatchRewardsAwardedEvent.EVENT_TYPE.equals(e.getEventType())).count());
        printSuccess("Level recomputed from 1060 xp, level-2 cosmetic unlocked");
    }

    @Test
    @DisplayName("Experience formula is 100 + 10k + 50w + 1s")
    void testExperienceFormula() {
        printTestHeader("Experience Formula");
        long playerId = newPlayerId();

        MatchRewardResult result = matchRewardService.awardMatchRewards(playerId, 7, 3, 4, 25, 0);

        assertEquals(100 + 70 + 200 + 25, result.getExperienceAwarded());
        printSuccess("395 xp awarded");
    }

    @Test
    @DisplayName("Negative stats are rejected before anything is written")
    void testNegativeStatsRejected() {
        printTestHeader("Invalid Stats");
        long playerId = newPlayerId();

        assertThrows(InvalidMatchStatsException.class,
                () -> matchRewardService.awardMatchRewards(playerId, -1, 0, 0, 0, 0));
        assertThrows(InvalidMatchStatsException.class,
                () -> matchRewardService.awardMatchRewards(playerId, 0, 0, 0, 0, -5));

        assertFalse(progressionExists(playerId));
        printSuccess("No progression row created");
    }

    @Test
    @DisplayName("Counters above the per-match bound are rejected before anything is written")
    void testOversizedStatsRejected() {
        printTestHeader("Oversized Stats");
        long playerId = newPlayerId();
        printInput("scrap_earned", 3_000_000_000_000L);

        InvalidMatchStatsException rejected = assertThrows(InvalidMatchStatsException.class,
                () -> matchRewardService.awardMatch(newMatchId(), "s",
                        List.of(stats(playerId, 0, 0, 3_000_000_000_000L, 0))));
        assertTrue(rejected.getMessage().contains("scrap_earned"));

        assertThrows(InvalidMatchStatsException.class,
                () -> matchRewardService.awardMatchRewards(playerId, 0, 0, 0, 0, Long.MAX_VALUE));

        MatchRewardResult atBound = matchRewardService.awardMatchRewards(playerId, 0, 0, 0,
                PlayerMatchStats.MAX_PER_MATCH, 0);
        assertEquals(100 + PlayerMatchStats.MAX_PER_MATCH, atBound.getExperienceAwarded());
        printSuccess("Only the bounded line was applied");
    }

    @Test
    @DisplayName("Data earned is credited as a match reward referencing the match")
    void testCurrencyCredit() {
        printTestHeader("Currency Credit");
        long playerId = newPlayerId();
        String matchId = newMatchId();

        MatchAwardOutcome outcome = matchRewardService.awardMatch(matchId, "server-1",
                List.of(stats(playerId, 2, 1, 10, 40)));

        assertFalse(outcome.isDuplicate());
        assertEquals(40, outcome.getResults().get(0).getCurrencyBalance());

        List<CurrencyTransaction> log = ledgerService.getTransactions(playerId);
        assertEquals(1, log.size());
        assertEquals(40, log.get(0).getAmount());
        assertEquals(TransactionKind.MATCH_REWARD, log.get(0).getKind());
        assertEquals(matchId, log.get(0).getReferenceId());
        assertEquals(40, progressionService.getProgression(playerId).getTotalCurrencyEarned());
        printSuccess("One match_reward transaction of 40");
    }

    @Test
    @DisplayName("Re-submitting a match is reported as a duplicate and applies nothing")
    void testMatchIsIdempotent() {
        printTestHeader("Match Idempotency");
        long first = newPlayerId();
        long second = newPlayerId();
        String matchId = newMatchId();
        List<PlayerMatchStats> players = List.of(stats(first, 1, 0, 0, 10), stats(second, 0, 2, 0, 0));

        MatchAwardOutcome awarded = matchRewardService.awardMatch(matchId, "server-1", players);
        MatchAwardOutcome again = matchRewardService.awardMatch(matchId, "server-1", players);
        printOutput("First", awarded);
        printOutput("Second", again);

        assertFalse(awarded.isDuplicate());
        assertEquals(2, awarded.getResults().size());
        assertTrue(again.isDuplicate());
        assertTrue(again.getResults().isEmpty());

        assertEquals(110, progressionService.getProgression(first).getExperience());
        assertEquals(200, progressionService.getProgression(second).getExperience());
        assertEquals(1, progressionService.getProgression(first).getTotalMatchesPlayed());
        assertEquals(10, ledgerService.getBalance(first));
        assertTrue(receiptRepository.existsByMatchId(matchId));
        printSuccess("Second submission ignored");
    }

    @Test
    @DisplayName("A storage failure for one player rolls back the whole match")
    void testMatchIsAtomic() {
        printTestHeader("Match Atomicity");
        long healthy = newPlayerId();
        long nearlyFull = newPlayerId();
        String matchId = newMatchId();
        ledgerService.adjustBalance(nearlyFull, Long.MAX_VALUE - 10, TransactionKind.ADMIN_GRANT, null);

        // When: crediting 100 overflows the second player's balance column
        assertThrows(DataAccessException.class, () -> matchRewardService.awardMatch(matchId, "server-1",
                List.of(stats(healthy, 5, 5, 5, 5), stats(nearlyFull, 0, 0, 0, 100))));

        // Then
        assertFalse(progressionExists(healthy), "first player's reward must roll back");
        assertEquals(Long.MAX_VALUE - 10, ledgerService.getBalance(nearlyFull));
        assertEquals(0, progressionService.getProgression(nearlyFull).getTotalMatchesPlayed());
        assertFalse(receiptRepository.existsByMatchId(matchId), "receipt must roll back too");

        // And the corrected match can still be applied
        MatchAwardOutcome retried = matchRewardService.awardMatch(matchId, "server-1",
                List.of(stats(healthy, 5, 5, 5, 5), stats(nearlyFull, 0, 0, 0, 0)));
        assertFalse(retried.isDuplicate());
        assertTrue(progressionExists(healthy));
        printSuccess("Nothing from the failed match was visible");
    }

    @Test
    @DisplayName("A player listed twice in one match is rejected")
    void testDuplicatePlayerRejected() {
        printTestHeader("Duplicate Player In Match");
        long playerId = newPlayerId();

        assertThrows(InvalidMatchStatsException.class, () -> matchRewardService.awardMatch(newMatchId(), "s",
                List.of(stats(playerId, 1, 1, 1, 1), stats(playerId, 2, 2, 2, 2))));
        assertFalse(progressionExists(playerId));
        printSuccess("Rejected as invalid stats");
    }

    @Test
    @DisplayName("Empty and oversized rosters are rejected")
    void testRosterSize() {
        printTestHeader("Roster Size");

        assertThrows(InvalidMatchStatsException.class,
                () -> matchRewardService.awardMatch(newMatchId(), "s", List.of()));

        List<PlayerMatchStats> crowd = new ArrayList<>();
        for (int i = 0; i < 65; i++) {
            crowd.add(stats(newPlayerId(), 0, 0, 0, 0));
        }
        assertThrows(InvalidMatchStatsException.class,
                () -> matchRewardService.awardMatch(newMatchId(), "s", crowd));
        printSuccess("Roster bounds enforced");
    }
}

package com.flagship.player_progression.cosmetic;

import com.flagship.player_progression.ledger.CurrencyLedgerService;
import com.flagship.player_progression.ledger.CurrencyTransaction;
import com.flagship.player_progression.ledger.InsufficientCurrencyException;
import com.flagship.player_progression.ledger.TransactionKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Purchases: debit and grant happen together or not at all.
 */
@SpringBootTest
@Testcontainers
class CosmeticServiceTest {

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
    private CosmeticService cosmeticService;

    @Autowired
    private CurrencyLedgerService ledgerService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private static long newPlayerId() {
        return Math.abs(UUID.randomUUID().getMostSignificantBits() % 1_000_000_000L) + 1;
    }

    private Long insertCosmetic(String name, String slot, long dataCost) {
        return jdbcTemplate.queryForObject(
                "INSERT INTO cosmetic_items (name, slot, rarity, unlock_level, data_cost) " +
                "VALUES (?, ?, 'rare', 1, ?) RETURNING cosmetic_id",
                Long.class, name, slot, dataCost);
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @Test
    @DisplayName("Buying a 150-cost item from 200 leaves 50 and logs one debit")
    void testPurchase() {
        printTestHeader("Purchase");
        long playerId = newPlayerId();
        Long cosmeticId = insertCosmetic("Rust Visor", "character_skin", 150);
        ledgerService.adjustBalance(playerId, 200, TransactionKind.ADMIN_GRANT, null);

        // When
        PurchaseResult result = cosmeticService.purchaseCosmetic(playerId, cosmeticId);
        printOutput("Result", result);

        // Then
        assertEquals(50, result.getBalanceAfter());
        assertEquals(cosmeticId, result.getCosmetic().getCosmeticId());
        assertEquals(50, ledgerService.getBalance(playerId));

        List<CurrencyTransaction> log = ledgerService.getTransactions(playerId);
        assertEquals(2, log.size());
        CurrencyTransaction debit = log.get(1);
        assertEquals(-150, debit.getAmount());
        assertEquals(50, debit.getBalanceAfter());
        assertEquals(TransactionKind.PURCHASE, debit.getKind());
        assertEquals(String.valueOf(cosmeticId), debit.getReferenceId());

        List<OwnedCosmetic> owned = cosmeticService.getOwnedCosmetics(playerId);
        assertEquals(1, owned.size());
        assertEquals(UnlockMethod.PURCHASE, owned.get(0).getUnlockedVia());
        printSuccess("Debited once and granted");
    }

    @Test
    @DisplayName("Buying an owned item fails and charges nothing")
    void testPurchaseAlreadyOwned() {
        printTestHeader("Already Owned");
        long playerId = newPlayerId();
        Long cosmeticId = insertCosmetic("Static Emote", "emote", 40);
        ledgerService.adjustBalance(playerId, 100, TransactionKind.ADMIN_GRANT, null);
        cosmeticService.purchaseCosmetic(playerId, cosmeticId);

        assertThrows(CosmeticAlreadyOwnedException.class,
                () -> cosmeticService.purchaseCosmetic(playerId, cosmeticId));

        assertEquals(60, ledgerService.getBalance(playerId));
        assertEquals(2, ledgerService.getTransactions(playerId).size());
        printSuccess("Second purchase rejected");
    }

    @Test
    @DisplayName("Insufficient balance leaves balance, log and ownership untouched")
    void testPurchaseInsufficientFunds() {
        printTestHeader("Insufficient Funds");
        long playerId = newPlayerId();
        Long cosmeticId = insertCosmetic("Gilded Rifle", "weapon_skin", 500);
        ledgerService.adjustBalance(playerId, 100, TransactionKind.ADMIN_GRANT, null);

        InsufficientCurrencyException e = assertThrows(InsufficientCurrencyException.class,
                () -> cosmeticService.purchaseCosmetic(playerId, cosmeticId));
        printOutput("Exception", e.getMessage());

        assertEquals(100, ledgerService.getBalance(playerId));
        assertEquals(1, ledgerService.getTransactions(playerId).size());
        assertTrue(cosmeticService.getOwnedCosmetics(playerId).isEmpty());
        printSuccess("Nothing changed");
    }

    @Test
    @DisplayName("Unknown cosmetic is reported as not found")
    void testPurchaseUnknownCosmetic() {
        printTestHeader("Unknown Cosmetic");
        long playerId = newPlayerId();

        assertThrows(CosmeticNotFoundException.class,
                () -> cosmeticService.purchaseCosmetic(playerId, Long.MAX_VALUE));
        printSuccess("Not found");
    }

    @Test
    @DisplayName("A free item is granted without a ledger entry")
    void testFreePurchase() {
        printTestHeader("Free Purchase");
        long playerId = newPlayerId();
        Long cosmeticId = insertCosmetic("Starter Title", "title", 0);

        PurchaseResult result = cosmeticService.purchaseCosmetic(playerId, cosmeticId);

        assertEquals(0, result.getBalanceAfter());
        assertTrue(ledgerService.getTransactions(playerId).isEmpty());
        assertEquals(1, cosmeticService.getOwnedCosmetics(playerId).size());
        printSuccess("Granted for free");
    }

    @Test
    @DisplayName("Concurrent purchases of one item charge the player exactly once")
    void testConcurrentPurchase() throws InterruptedException {
        printTestHeader("Concurrent Purchase");
        long playerId = newPlayerId();
        Long cosmeticId = insertCosmetic("Ember Trail", "particle_effect", 100);
        ledgerService.adjustBalance(playerId, 1000, TransactionKind.ADMIN_GRANT, null);

        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger succeeded = new AtomicInteger();
        AtomicInteger alreadyOwned = new AtomicInteger();

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    cosmeticService.purchaseCosmetic(playerId, cosmeticId);
                    succeeded.incrementAndGet();
                } catch (CosmeticAlreadyOwnedException e) {
                    alreadyOwned.incrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertTrue(done.await(30, TimeUnit.SECONDS));
        executor.shutdown();

        printOutput("Succeeded", succeeded.get());
        printOutput("Already owned", alreadyOwned.get());
        assertEquals(1, succeeded.get());
        assertEquals(threads - 1, alreadyOwned.get());
        assertEquals(900, ledgerService.getBalance(playerId));
        assertEquals(2, ledgerService.getTransactions(playerId).size());
        printSuccess("Charged once");
    }
}

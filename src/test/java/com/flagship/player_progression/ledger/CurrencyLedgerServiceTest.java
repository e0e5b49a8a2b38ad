package com.flagship.player_progression.ledger;

import com.flagship.player_progression.progression.ProgressionStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.IllegalTransactionStateException;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Currency ledger: balance and transaction log move together, the balance
 * never goes negative, and the log is append-only.
 */
@SpringBootTest
@Testcontainers
class CurrencyLedgerServiceTest {

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
    private CurrencyLedgerService ledgerService;

    @Autowired
    private ProgressionStore progressionStore;

    @Autowired
    private JdbcTemplate jdbcTemplate;

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
    @DisplayName("Balance equals the sum of logged amounts and each row records the running balance")
    void testBalanceMatchesTransactionLog() {
        printTestHeader("Balance Matches Transaction Log");
        long playerId = newPlayerId();

        // When
        ledgerService.applyCurrencyDelta(playerId, 200, TransactionKind.MATCH_REWARD, "match-1");
        ledgerService.applyCurrencyDelta(playerId, 75, TransactionKind.ADMIN_GRANT, null);
        ledgerService.applyCurrencyDelta(playerId, -150, TransactionKind.PURCHASE, "42");

        // Then
        List<CurrencyTransaction> log = ledgerService.getTransactions(playerId);
        long balance = ledgerService.getBalance(playerId);
        System.out.println("Transactions: " + log);
        System.out.println("Balance: " + balance);

        assertEquals(3, log.size());
        assertEquals(125, balance);
        assertEquals(balance, log.stream().mapToLong(CurrencyTransaction::getAmount).sum());

        long running = 0;
        for (CurrencyTransaction transaction : log) {
            running += transaction.getAmount();
            assertEquals(running, transaction.getBalanceAfter(), "balance_after must replay");
        }
        assertEquals(TransactionKind.PURCHASE, log.get(2).getKind());
        assertEquals("42", log.get(2).getReferenceId());

        printSuccess("Ledger replays to the balance");
    }

    @Test
    @DisplayName("A debit larger than the balance is rejected and writes nothing")
    void testOverDebitRejected() {
        printTestHeader("Over-Debit Rejected");
        long playerId = newPlayerId();
        ledgerService.applyCurrencyDelta(playerId, 100, TransactionKind.MATCH_REWARD, null);

        // When / Then
        InsufficientCurrencyException e = assertThrows(InsufficientCurrencyException.class,
                () -> ledgerService.applyCurrencyDelta(playerId, -101, TransactionKind.PURCHASE, "7"));
        System.out.println("Exception: " + e.getMessage());

        assertEquals(100, ledgerService.getBalance(playerId));
        assertEquals(1, ledgerService.getTransactions(playerId).size());
        printSuccess("Balance unchanged after rejected debit");
    }

    @Test
    @DisplayName("A zero delta is a no-op")
    void testZeroDeltaIsNoOp() {
        printTestHeader("Zero Delta");
        long playerId = newPlayerId();

        Optional<CurrencyTransaction> result =
                ledgerService.applyCurrencyDelta(playerId, 0, TransactionKind.OTHER, null);

        assertTrue(result.isEmpty());
        assertTrue(ledgerService.getTransactions(playerId).isEmpty());
        assertEquals(0, ledgerService.getBalance(playerId));
        printSuccess("Nothing recorded");
    }

    @Test
    @DisplayName("Ledger rows cannot be updated or deleted")
    void testTransactionsAreAppendOnly() {
        printTestHeader("Append-Only Ledger");
        long playerId = newPlayerId();
        CurrencyTransaction transaction = ledgerService
                .applyCurrencyDelta(playerId, 50, TransactionKind.ADMIN_GRANT, null)
                .orElseThrow();

        assertThrows(DataAccessException.class, () -> jdbcTemplate.update(
                "UPDATE currency_transactions SET amount = 5000 WHERE transaction_id = ?",
                transaction.getTransactionId()));
        assertThrows(DataAccessException.class, () -> jdbcTemplate.update(
                "DELETE FROM currency_transactions WHERE transaction_id = ?",
                transaction.getTransactionId()));

        assertEquals(50, ledgerService.getTransactions(playerId).get(0).getAmount());
        printSuccess("Trigger rejected UPDATE and DELETE");
    }

    @Test
    @DisplayName("Concurrent debits never overdraw the balance")
    void testConcurrentDebits() throws Exception {
        printTestHeader("Concurrent Debits");
        long playerId = newPlayerId();
        ledgerService.applyCurrencyDelta(playerId, 100, TransactionKind.ADMIN_GRANT, null);

        int threads = 10;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        AtomicInteger succeeded = new AtomicInteger();
        AtomicInteger rejected = new AtomicInteger();

        for (int i = 0; i < threads; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    ledgerService.applyCurrencyDelta(playerId, -30, TransactionKind.PURCHASE, null);
                    succeeded.incrementAndGet();
                } catch (InsufficientCurrencyException e) {
                    rejected.incrementAndGet();
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

        System.out.println("Succeeded: " + succeeded.get() + ", rejected: " + rejected.get());
        assertEquals(3, succeeded.get());
        assertEquals(7, rejected.get());
        assertEquals(10, ledgerService.getBalance(playerId));
        assertEquals(4, ledgerService.getTransactions(playerId).size());
        printSuccess("Exactly three debits of 30 fit in 100");
    }

    @Test
    @DisplayName("Manual adjustments accept only operator transaction types")
    void testAdjustBalanceRejectsEngineKinds() {
        printTestHeader("Manual Adjustment Types");
        long playerId = newPlayerId();

        assertThrows(IllegalArgumentException.class,
                () -> ledgerService.adjustBalance(playerId, 10, TransactionKind.PURCHASE, null));
        assertTrue(ledgerService.adjustBalance(playerId, 10, TransactionKind.REFUND, "ticket-9").isPresent());
        assertEquals(10, ledgerService.getBalance(playerId));
        printSuccess("Only ADMIN_GRANT, REFUND and OTHER can be posted by hand");
    }

    @Test
    @DisplayName("Store mutators refuse to run outside a transaction")
    void testStoreRequiresTransaction() {
        printTestHeader("Mandatory Transaction");

        assertThrows(IllegalTransactionStateException.class,
                () -> progressionStore.ensureExists(newPlayerId()));
        printSuccess("ensureExists requires a surrounding transaction");
    }
}

package com.flagship.credits_ledger.ledger;

import com.flagship.credits_ledger.exception.CreditsValidationException;
import com.flagship.credits_ledger.exception.WalletFrozenException;
import com.flagship.credits_ledger.exception.WalletNotFoundException;
import com.flagship.credits_ledger.wallet.Wallet;
import com.flagship.credits_ledger.wallet.WalletDirectory;
import com.flagship.credits_ledger.wallet.WalletStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Ledger log tests: idempotent appends, frozen-wallet rules and immutability.
 */
@SpringBootTest
@Testcontainers
class LedgerLogTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("credits_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        // No Kafka in these tests
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("credits.holds.expiry.enabled", () -> "false");
    }

    @Autowired
    private LedgerLog ledgerLog;

    @Autowired
    private WalletDirectory walletDirectory;

    @Autowired
    private BalanceCalculator balanceCalculator;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private String organizationId;
    private Wallet wallet;

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

    private void printExpectedException(String exceptionType, String reason) {
        System.out.println("⚠ EXPECTED EXCEPTION: " + exceptionType);
        System.out.println("  Reason: " + reason);
    }

    @BeforeEach
    void setUp() {
        organizationId = "org-" + UUID.randomUUID();
        wallet = walletDirectory.ensureWallet(organizationId, "user-1");
    }

    private RecordedEntry credit(long amount, String key) {
        return ledgerLog.insertLedgerEntry(organizationId, wallet.getId(), EntryDirection.CREDIT, amount,
                LedgerReason.PURCHASE, new EntryReference.Purchase("woocommerce", "order-" + key), key);
    }

    private RecordedEntry adjustDown(long amount, String key) {
        return ledgerLog.insertLedgerEntry(organizationId, wallet.getId(), EntryDirection.DEBIT, amount,
                LedgerReason.MANUAL_ADJUSTMENT, new EntryReference.Adjustment("correction", "ops"), key);
    }

    private int countEntries() {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM credit_ledger_entries WHERE wallet_id = ?", Integer.class, wallet.getId());
        return count != null ? count : 0;
    }

    @Nested
    @DisplayName("Idempotency")
    class Idempotency {

        @Test
        @DisplayName("Replaying a key returns the original id and writes nothing")
        void testReplayReturnsOriginalId() {
            printTestHeader("Ledger - Idempotent Replay");

            RecordedEntry first = credit(500, "purchase-1");
            RecordedEntry replay = credit(500, "purchase-1");

            printOutput("First", first);
            printOutput("Replay", replay);

            assertTrue(first.isCreated());
            assertFalse(replay.isCreated());
            assertEquals(first.getId(), replay.getId());
            assertEquals(1, countEntries());
            assertEquals(500, balanceCalculator.getBalances(organizationId, wallet.getId()).getBalance());

            printSuccess("Credit applied once");
        }

        @Test
        @DisplayName("The same key in another wallet is a different entry")
        void testKeyIsScopedToWallet() {
            printTestHeader("Ledger - Key Scoped Per Wallet");

            Wallet other = walletDirectory.ensureWallet(organizationId, "user-2");

            RecordedEntry mine = credit(100, "shared-key");
            RecordedEntry theirs = ledgerLog.insertLedgerEntry(organizationId, other.getId(), EntryDirection.CREDIT,
                    100, LedgerReason.PURCHASE, new EntryReference.Purchase("woocommerce", "o"), "shared-key");

            assertTrue(theirs.isCreated());
            assertNotEquals(mine.getId(), theirs.getId());

            printSuccess("Keys do not collide across wallets");
        }
    }

    @Nested
    @DisplayName("Wallet rules")
    class WalletRules {

        @Test
        @DisplayName("Debits are not balance-checked")
        void testDebitMayOverdraw() {
            printTestHeader("Ledger - Manual Debit Overdraws");

            credit(100, "c1");
            adjustDown(250, "d1");

            Balances balances = balanceCalculator.getBalances(organizationId, wallet.getId());
            printOutput("Balances", balances);

            assertEquals(-150, balances.getAvailable());
            assertEquals(-150, balances.getBalance());

            printSuccess("Negative balance reachable through manual adjustment");
        }

        @Test
        @DisplayName("A frozen wallet refuses new debits but replays old ones and accepts credits")
        void testFrozenWallet() {
            printTestHeader("Ledger - Frozen Wallet");

            credit(1000, "c1");
            RecordedEntry debit = adjustDown(100, "d1");
            walletDirectory.updateStatus(organizationId, wallet.getId(), WalletStatus.FROZEN);

            WalletFrozenException e = assertThrows(WalletFrozenException.class, () -> adjustDown(100, "d2"));
            printExpectedException("WalletFrozenException", e.getMessage());

            RecordedEntry replay = adjustDown(100, "d1");
            assertEquals(debit.getId(), replay.getId());
            assertFalse(replay.isCreated());

            assertTrue(credit(50, "c2").isCreated());
            assertEquals(3, countEntries());

            printSuccess("Frozen wallet rules hold");
        }

        @Test
        @DisplayName("Unknown wallets are rejected for credits and debits")
        void testUnknownWallet() {
            printTestHeader("Ledger - Unknown Wallet");

            UUID unknown = UUID.randomUUID();
            assertThrows(WalletNotFoundException.class, () -> ledgerLog.insertLedgerEntry(organizationId, unknown,
                    EntryDirection.CREDIT, 10, LedgerReason.PURCHASE,
                    new EntryReference.Purchase("woocommerce", "o"), "k1"));
            assertThrows(WalletNotFoundException.class, () -> ledgerLog.insertLedgerEntry(organizationId, unknown,
                    EntryDirection.DEBIT, 10, LedgerReason.MANUAL_ADJUSTMENT,
                    new EntryReference.Adjustment("x", "ops"), "k2"));
            assertThrows(WalletNotFoundException.class, () -> ledgerLog.insertLedgerEntry("other-org",
                    wallet.getId(), EntryDirection.CREDIT, 10, LedgerReason.PURCHASE,
                    new EntryReference.Purchase("woocommerce", "o"), "k3"));

            printSuccess("Nothing written for unknown wallets");
        }

        @Test
        @DisplayName("Capture entries cannot be written directly")
        void testCaptureReasonRejected() {
            printTestHeader("Ledger - Direct Capture Rejected");

            assertThrows(CreditsValidationException.class, () -> ledgerLog.insertLedgerEntry(organizationId,
                    wallet.getId(), EntryDirection.DEBIT, 10, LedgerReason.CAPTURE,
                    new EntryReference.Capture("woocommerce", "o", UUID.randomUUID()), "k"));
            assertEquals(0, countEntries());

            printSuccess("Capture is reserved for hold capture");
        }
    }

    @Test
    @DisplayName("History reads back in write order with typed references")
    void testFindEntries() {
        printTestHeader("Ledger - History");

        RecordedEntry c1 = credit(300, "c1");
        RecordedEntry d1 = adjustDown(100, "d1");
        RecordedEntry r1 = ledgerLog.insertLedgerEntry(organizationId, wallet.getId(), EntryDirection.CREDIT, 40,
                LedgerReason.REFUND, new EntryReference.Refund("woocommerce", "order-9", "damaged"), "r1");

        List<LedgerEntry> entries = ledgerLog.findEntries(organizationId, wallet.getId());
        entries.forEach(entry -> printOutput("Entry", entry));

        assertEquals(List.of(c1.getId(), d1.getId(), r1.getId()),
                entries.stream().map(LedgerEntry::getId).toList());
        assertEquals(new EntryReference.Purchase("woocommerce", "order-c1"), entries.get(0).getReference());
        assertEquals(new EntryReference.Adjustment("correction", "ops"), entries.get(1).getReference());
        assertEquals(new EntryReference.Refund("woocommerce", "order-9", "damaged"), entries.get(2).getReference());
        assertEquals(-100, entries.get(1).signedAmount());
        assertEquals(240, entries.stream().mapToLong(LedgerEntry::signedAmount).sum());

        printSuccess("History matches what was written");
    }

    @Test
    @DisplayName("Entries cannot be updated or deleted")
    void testEntriesAreImmutable() {
        printTestHeader("Ledger - Append Only");

        RecordedEntry entry = credit(100, "c1");

        DataAccessException update = assertThrows(DataAccessException.class, () -> jdbcTemplate.update(
                "UPDATE credit_ledger_entries SET amount = 1 WHERE id = ?", entry.getId()));
        printExpectedException("DataAccessException", update.getMostSpecificCause().getMessage());

        assertThrows(DataAccessException.class, () -> jdbcTemplate.update(
                "DELETE FROM credit_ledger_entries WHERE id = ?", entry.getId()));

        assertEquals(100, balanceCalculator.getBalances(organizationId, wallet.getId()).getBalance());

        printSuccess("Database trigger rejected both changes");
    }

    @Test
    @DisplayName("Recording an entry keeps the caller's walletId logging context")
    void testCallerLoggingContextSurvives() {
        printTestHeader("Ledger - Logging Context");

        MDC.put("walletId", "caller-context");
        try {
            credit(100, "c1");
            printOutput("walletId after insert", MDC.get("walletId"));
            assertEquals("caller-context", MDC.get("walletId"));
        } finally {
            MDC.remove("walletId");
        }

        credit(100, "c2");
        assertNull(MDC.get("walletId"));

        printSuccess("Outer context restored, no context leaked");
    }
}

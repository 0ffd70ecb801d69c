package com.flagship.credits_ledger.outbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.credits_ledger.event.HoldCapturedEvent;
import com.flagship.credits_ledger.event.HoldCreatedEvent;
import com.flagship.credits_ledger.event.HoldExpiredEvent;
import com.flagship.credits_ledger.event.HoldReleasedEvent;
import com.flagship.credits_ledger.event.LedgerEntryRecordedEvent;
import com.flagship.credits_ledger.exception.HoldExpiredException;
import com.flagship.credits_ledger.exception.InsufficientCreditsException;
import com.flagship.credits_ledger.hold.CaptureResult;
import com.flagship.credits_ledger.hold.HoldEngine;
import com.flagship.credits_ledger.ledger.EntryDirection;
import com.flagship.credits_ledger.ledger.EntryReference;
import com.flagship.credits_ledger.ledger.LedgerLog;
import com.flagship.credits_ledger.ledger.LedgerReason;
import com.flagship.credits_ledger.wallet.Wallet;
import com.flagship.credits_ledger.wallet.WalletDirectory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.IllegalTransactionStateException;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox tests: every committed change writes exactly one event, rolled back changes
 * write none, and relay bookkeeping works.
 */
@SpringBootTest
@Testcontainers
class OutboxServiceTest {

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
        // Publisher off: events stay in the table for inspection
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("credits.holds.expiry.enabled", () -> "false");
    }

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private WalletDirectory walletDirectory;

    @Autowired
    private LedgerLog ledgerLog;

    @Autowired
    private HoldEngine holdEngine;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private ObjectMapper objectMapper;

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

    @BeforeEach
    void setUp() {
        organizationId = "org-" + UUID.randomUUID();
        wallet = walletDirectory.ensureWallet(organizationId, "user-1");
    }

    private void fund(long amount, String key) {
        ledgerLog.insertLedgerEntry(organizationId, wallet.getId(), EntryDirection.CREDIT, amount,
                LedgerReason.PURCHASE, new EntryReference.Purchase("woocommerce", "topup"), key);
    }

    private List<String> eventTypes() {
        return outboxService.getEventsForWallet(wallet.getId()).stream()
                .map(OutboxEvent::getEventType)
                .toList();
    }

    @Test
    @DisplayName("Each committed change writes one event, in order; replays write none")
    void testEventsPerChange() {
        printTestHeader("Outbox - Events Per Change");

        fund(500, "c1");
        fund(500, "c1");
        UUID captured = holdEngine.createHold(organizationId, wallet.getId(), "woocommerce", "o1", 200, 900)
                .getHoldId();
        UUID released = holdEngine.createHold(organizationId, wallet.getId(), "woocommerce", "o2", 100, 900)
                .getHoldId();
        holdEngine.captureHold(organizationId, captured, "cap-o1");
        holdEngine.releaseHold(organizationId, released);
        holdEngine.releaseHold(organizationId, released);

        List<String> types = eventTypes();
        printOutput("Event types", types);

        assertEquals(List.of(
                LedgerEntryRecordedEvent.EVENT_TYPE,
                HoldCreatedEvent.EVENT_TYPE,
                HoldCreatedEvent.EVENT_TYPE,
                LedgerEntryRecordedEvent.EVENT_TYPE,
                HoldCapturedEvent.EVENT_TYPE,
                HoldReleasedEvent.EVENT_TYPE
        ), types);

        outboxService.getEventsForWallet(wallet.getId()).forEach(event -> {
            assertEquals("Wallet", event.getAggregateType());
            assertEquals(organizationId, event.getOrganizationId());
            assertFalse(event.isPublished());
        });

        printSuccess("Outbox mirrors the committed changes");
    }

    @Test
    @DisplayName("Rejected changes leave no event; an expiry found at capture does")
    void testRollbackAndExpiry() {
        printTestHeader("Outbox - Rollback And Expiry");

        fund(100, "c1");
        assertThrows(InsufficientCreditsException.class, () -> holdEngine.createHold(
                organizationId, wallet.getId(), "woocommerce", "o1", 101, 900));
        assertEquals(List.of(LedgerEntryRecordedEvent.EVENT_TYPE), eventTypes());

        UUID holdId = holdEngine.createHold(organizationId, wallet.getId(), "woocommerce", "o1", 100, 900)
                .getHoldId();
        jdbcTemplate.update("UPDATE credit_holds SET expires_at = now() - interval '1 second' WHERE id = ?", holdId);
        assertThrows(HoldExpiredException.class, () -> holdEngine.captureHold(organizationId, holdId, "cap-1"));

        List<String> types = eventTypes();
        printOutput("Event types", types);
        assertEquals(List.of(
                LedgerEntryRecordedEvent.EVENT_TYPE,
                HoldCreatedEvent.EVENT_TYPE,
                HoldExpiredEvent.EVENT_TYPE
        ), types);

        printSuccess("Only committed changes produced events");
    }

    @Test
    @DisplayName("Capture payload links the hold and the ledger entry")
    void testCapturePayload() throws Exception {
        printTestHeader("Outbox - Capture Payload");

        fund(500, "c1");
        UUID holdId = holdEngine.createHold(organizationId, wallet.getId(), "woocommerce", "o1", 200, 900)
                .getHoldId();
        CaptureResult result = holdEngine.captureHold(organizationId, holdId, "cap-o1");

        OutboxEvent event = outboxService.getEventsForWallet(wallet.getId()).stream()
                .filter(e -> e.getEventType().equals(HoldCapturedEvent.EVENT_TYPE))
                .findFirst()
                .orElseThrow();
        JsonNode payload = objectMapper.readTree(event.getPayload());
        printOutput("Payload", payload);

        assertEquals(holdId.toString(), payload.get("holdId").asText());
        assertEquals(result.getLedgerEntryId().toString(), payload.get("ledgerEntryId").asText());
        assertEquals(wallet.getId().toString(), payload.get("walletId").asText());
        assertEquals(200, payload.get("amount").asLong());
        assertEquals(event.getId().toString(), payload.get("eventId").asText());

        JsonNode recorded = objectMapper.readTree(outboxService.getEventsForWallet(wallet.getId()).get(0).getPayload());
        assertEquals("purchase", recorded.get("reference").get("type").asText());
        assertEquals("CREDIT", recorded.get("direction").asText());

        printSuccess("Payload carries correlating ids");
    }

    @Test
    @DisplayName("Events cannot be saved outside a business transaction")
    void testSaveEventRequiresTransaction() {
        printTestHeader("Outbox - Mandatory Transaction");

        HoldReleasedEvent orphan = new HoldReleasedEvent(UUID.randomUUID(), organizationId, wallet.getId(),
                UUID.randomUUID(), "o1", 1, Instant.now());

        assertThrows(IllegalTransactionStateException.class, () -> outboxService.saveEvent(orphan));
        assertTrue(eventTypes().isEmpty());

        printSuccess("Orphan event rejected");
    }

    @Test
    @DisplayName("Published events leave the backlog; failing ones dead-letter after max retries")
    void testRelayBookkeeping() {
        printTestHeader("Outbox - Relay Bookkeeping");

        fund(100, "c1");
        fund(100, "c2");
        List<OutboxEvent> events = outboxService.getEventsForWallet(wallet.getId());
        OutboxEvent published = events.get(0);
        OutboxEvent failing = events.get(1);

        outboxService.markPublished(published.getId());
        int maxRetries = 3;
        for (int i = 0; i < maxRetries; i++) {
            outboxService.markFailed(failing.getId(), "broker unavailable");
        }

        List<UUID> pending = outboxService.findUnpublishedEvents(maxRetries, 10_000).stream()
                .map(OutboxEvent::getId)
                .toList();
        assertFalse(pending.contains(published.getId()));
        assertFalse(pending.contains(failing.getId()));

        List<OutboxEvent> after = outboxService.getEventsForWallet(wallet.getId());
        assertTrue(after.get(0).isPublished());
        assertEquals(maxRetries, after.get(1).getRetryCount());
        assertEquals("broker unavailable", after.get(1).getLastError());
        assertTrue(after.get(1).isDeadLettered(maxRetries));

        printSuccess("Relay state tracked per event");
    }
}

package com.flagship.credits_ledger.ledger;

import com.flagship.credits_ledger.exception.CreditsValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Validation of ledger requests happens before anything touches the store.
 */
class LedgerEntryRequestTest {

    private static final String ORG = "org-1";
    private final UUID walletId = UUID.randomUUID();
    private final EntryReference.Purchase purchase = new EntryReference.Purchase("woocommerce", "order-1");

    @Test
    @DisplayName("A well-formed purchase credit is accepted")
    void acceptsPurchaseCredit() {
        LedgerEntryRequest request = LedgerEntryRequest.of(
                ORG, walletId, EntryDirection.CREDIT, 500, LedgerReason.PURCHASE, purchase, "key-1");

        assertEquals(500, request.getAmount());
        assertEquals(LedgerReason.PURCHASE, request.getReason());
    }

    @Test
    @DisplayName("Zero and negative amounts are rejected")
    void rejectsNonPositiveAmount() {
        assertThrows(CreditsValidationException.class, () -> LedgerEntryRequest.of(
                ORG, walletId, EntryDirection.CREDIT, 0, LedgerReason.PURCHASE, purchase, "k"));
        assertThrows(CreditsValidationException.class, () -> LedgerEntryRequest.of(
                ORG, walletId, EntryDirection.CREDIT, -1, LedgerReason.PURCHASE, purchase, "k"));
    }

    @Test
    @DisplayName("Reference variant must match the reason")
    void rejectsMismatchedReference() {
        EntryReference adjustment = new EntryReference.Adjustment("fix", "ops");

        CreditsValidationException e = assertThrows(CreditsValidationException.class, () -> LedgerEntryRequest.of(
                ORG, walletId, EntryDirection.CREDIT, 10, LedgerReason.PURCHASE, adjustment, "k"));
        assertTrue(e.getMessage().contains("does not match"));
    }

    @Test
    @DisplayName("Reason must allow the direction")
    void rejectsDisallowedDirection() {
        assertThrows(CreditsValidationException.class, () -> LedgerEntryRequest.of(
                ORG, walletId, EntryDirection.DEBIT, 10, LedgerReason.PURCHASE, purchase, "k"));
        assertThrows(CreditsValidationException.class, () -> LedgerEntryRequest.of(
                ORG, walletId, EntryDirection.DEBIT, 10, LedgerReason.REFUND,
                new EntryReference.Refund("woocommerce", "o", null), "k"));

        EntryReference adjustment = new EntryReference.Adjustment("fix", "ops");
        assertDoesNotThrow(() -> LedgerEntryRequest.of(
                ORG, walletId, EntryDirection.DEBIT, 10, LedgerReason.MANUAL_ADJUSTMENT, adjustment, "k"));
        assertDoesNotThrow(() -> LedgerEntryRequest.of(
                ORG, walletId, EntryDirection.CREDIT, 10, LedgerReason.MANUAL_ADJUSTMENT, adjustment, "k"));
    }

    @Test
    @DisplayName("Missing fields and blank or oversized keys are rejected")
    void rejectsMissingFields() {
        assertThrows(CreditsValidationException.class, () -> LedgerEntryRequest.of(
                ORG, walletId, null, 10, LedgerReason.PURCHASE, purchase, "k"));
        assertThrows(CreditsValidationException.class, () -> LedgerEntryRequest.of(
                ORG, walletId, EntryDirection.CREDIT, 10, null, purchase, "k"));
        assertThrows(CreditsValidationException.class, () -> LedgerEntryRequest.of(
                ORG, walletId, EntryDirection.CREDIT, 10, LedgerReason.PURCHASE, null, "k"));
        assertThrows(CreditsValidationException.class, () -> LedgerEntryRequest.of(
                ORG, walletId, EntryDirection.CREDIT, 10, LedgerReason.PURCHASE, purchase, " "));
        assertThrows(CreditsValidationException.class, () -> LedgerEntryRequest.of(
                ORG, walletId, EntryDirection.CREDIT, 10, LedgerReason.PURCHASE, purchase, "k".repeat(256)));
        assertThrows(CreditsValidationException.class, () -> LedgerEntryRequest.of(
                ORG, null, EntryDirection.CREDIT, 10, LedgerReason.PURCHASE, purchase, "k"));
    }

    @Test
    @DisplayName("Capture requests match only the entry they would have written")
    void captureMatching() {
        UUID holdId = UUID.randomUUID();
        EntryReference.Capture reference = new EntryReference.Capture("woocommerce", "order-1", holdId);
        LedgerEntryRequest request = LedgerEntryRequest.capture(ORG, walletId, 200, reference, "cap-1");

        LedgerEntry same = new LedgerEntry(UUID.randomUUID(), ORG, walletId, EntryDirection.DEBIT, 200,
                LedgerReason.CAPTURE, new EntryReference.Capture("woocommerce", "order-1", holdId),
                "cap-1", Instant.now());
        LedgerEntry otherHold = new LedgerEntry(UUID.randomUUID(), ORG, walletId, EntryDirection.DEBIT, 200,
                LedgerReason.CAPTURE, new EntryReference.Capture("woocommerce", "order-1", UUID.randomUUID()),
                "cap-1", Instant.now());

        assertTrue(request.matches(same));
        assertFalse(request.matches(otherHold));
    }

    @Test
    @DisplayName("Balances keep balance equal to available plus on hold")
    void balancesArithmetic() {
        Balances balances = Balances.of(500, 0, 200);

        assertEquals(300, balances.getAvailable());
        assertEquals(200, balances.getOnHold());
        assertEquals(500, balances.getBalance());
        assertTrue(balances.covers(300));
        assertFalse(balances.covers(301));
    }
}

package com.flagship.credits_ledger.ledger;

import com.flagship.credits_ledger.exception.CreditsValidationException;
import lombok.Value;

import java.util.UUID;

/**
 * A validated request to append one entry to a wallet's ledger.
 *
 * Construction is the validation step: an instance only exists if the amount is
 * positive, the reason allows the direction and the reference variant matches the
 * reason. Nothing here touches the store.
 */
@Value
public class LedgerEntryRequest {

    private static final int MAX_IDEMPOTENCY_KEY_LENGTH = 255;

    String organizationId;
    UUID walletId;
    EntryDirection direction;
    long amount;
    LedgerReason reason;
    EntryReference reference;
    String idempotencyKey;

    private LedgerEntryRequest(String organizationId, UUID walletId, EntryDirection direction, long amount,
                               LedgerReason reason, EntryReference reference, String idempotencyKey) {
        if (organizationId == null || organizationId.isBlank()) {
            throw new CreditsValidationException("Organization id is required");
        }
        if (walletId == null) {
            throw new CreditsValidationException("Wallet id is required");
        }
        if (direction == null) {
            throw new CreditsValidationException("Direction is required");
        }
        if (amount <= 0) {
            throw new CreditsValidationException("Amount must be positive, got " + amount);
        }
        if (reason == null) {
            throw new CreditsValidationException("Reason is required");
        }
        if (!reason.allows(direction)) {
            throw new CreditsValidationException(
                String.format("Reason %s cannot be recorded as %s", reason, direction));
        }
        if (reference == null) {
            throw new CreditsValidationException("Reference is required");
        }
        if (reference.reason() != reason) {
            throw new CreditsValidationException(
                String.format("Reference of type %s does not match reason %s",
                    reference.getClass().getSimpleName(), reason));
        }
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new CreditsValidationException("Idempotency key is required");
        }
        if (idempotencyKey.length() > MAX_IDEMPOTENCY_KEY_LENGTH) {
            throw new CreditsValidationException(
                "Idempotency key longer than " + MAX_IDEMPOTENCY_KEY_LENGTH + " characters");
        }
        this.organizationId = organizationId;
        this.walletId = walletId;
        this.direction = direction;
        this.amount = amount;
        this.reason = reason;
        this.reference = reference;
        this.idempotencyKey = idempotencyKey;
    }

    public static LedgerEntryRequest of(String organizationId, UUID walletId, EntryDirection direction,
                                        long amount, LedgerReason reason, EntryReference reference,
                                        String idempotencyKey) {
        return new LedgerEntryRequest(organizationId, walletId, direction, amount, reason, reference,
            idempotencyKey);
    }

    /**
     * Debit realizing a captured hold.
     */
    public static LedgerEntryRequest capture(String organizationId, UUID walletId, long amount,
                                             EntryReference.Capture reference, String idempotencyKey) {
        return new LedgerEntryRequest(organizationId, walletId, EntryDirection.DEBIT, amount,
            LedgerReason.CAPTURE, reference, idempotencyKey);
    }

    /**
     * True when an already-stored entry records the same movement as this request.
     */
    public boolean matches(LedgerEntry entry) {
        return entry.getWalletId().equals(walletId)
            && entry.getDirection() == direction
            && entry.getAmount() == amount
            && entry.getReason() == reason
            && reference.equals(entry.getReference());
    }
}

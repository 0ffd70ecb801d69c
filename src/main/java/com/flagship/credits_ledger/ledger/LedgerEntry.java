package com.flagship.credits_ledger.ledger;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One immutable line of a wallet's history. Never updated or deleted once written.
 */
@Value
public class LedgerEntry {
    UUID id;
    String organizationId;
    UUID walletId;
    EntryDirection direction;
    long amount;
    LedgerReason reason;
    EntryReference reference;
    String idempotencyKey;
    Instant createdAt;

    /**
     * Amount with the sign of its direction: positive for credits, negative for debits.
     */
    public long signedAmount() {
        return direction == EntryDirection.CREDIT ? amount : -amount;
    }
}

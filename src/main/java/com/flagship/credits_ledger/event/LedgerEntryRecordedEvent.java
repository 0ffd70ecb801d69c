package com.flagship.credits_ledger.event;

import com.flagship.credits_ledger.ledger.EntryDirection;
import com.flagship.credits_ledger.ledger.EntryReference;
import com.flagship.credits_ledger.ledger.LedgerEntryRequest;
import com.flagship.credits_ledger.ledger.LedgerReason;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published once per newly written ledger entry. Idempotent replays publish nothing.
 */
@Value
public class LedgerEntryRecordedEvent implements CreditEvent {
    UUID eventId;
    String organizationId;
    UUID walletId;
    UUID entryId;
    EntryDirection direction;
    long amount;
    LedgerReason reason;
    EntryReference reference;
    Instant occurredAt;

    public static final String EVENT_TYPE = "LedgerEntryRecorded";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static LedgerEntryRecordedEvent fromRequest(LedgerEntryRequest request, UUID entryId, Instant occurredAt) {
        return new LedgerEntryRecordedEvent(
            UUID.randomUUID(),
            request.getOrganizationId(),
            request.getWalletId(),
            entryId,
            request.getDirection(),
            request.getAmount(),
            request.getReason(),
            request.getReference(),
            occurredAt
        );
    }
}

package com.flagship.credits_ledger.event;

import com.flagship.credits_ledger.hold.Hold;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A hold was realized as a debit. Carries the id of the capture entry so consumers can
 * correlate with {@link LedgerEntryRecordedEvent}.
 */
@Value
public class HoldCapturedEvent implements CreditEvent {
    UUID eventId;
    String organizationId;
    UUID walletId;
    UUID holdId;
    String orderId;
    long amount;
    UUID ledgerEntryId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "HoldCaptured";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static HoldCapturedEvent fromHold(Hold captured, UUID ledgerEntryId) {
        return new HoldCapturedEvent(
            UUID.randomUUID(),
            captured.getOrganizationId(),
            captured.getWalletId(),
            captured.getId(),
            captured.getOrderId(),
            captured.getAmount(),
            ledgerEntryId,
            captured.getUpdatedAt()
        );
    }
}

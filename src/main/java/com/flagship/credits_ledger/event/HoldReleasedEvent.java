package com.flagship.credits_ledger.event;

import com.flagship.credits_ledger.hold.Hold;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class HoldReleasedEvent implements CreditEvent {
    UUID eventId;
    String organizationId;
    UUID walletId;
    UUID holdId;
    String orderId;
    long amount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "HoldReleased";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static HoldReleasedEvent fromHold(Hold released) {
        return new HoldReleasedEvent(
            UUID.randomUUID(),
            released.getOrganizationId(),
            released.getWalletId(),
            released.getId(),
            released.getOrderId(),
            released.getAmount(),
            released.getUpdatedAt()
        );
    }
}

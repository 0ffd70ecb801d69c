package com.flagship.credits_ledger.event;

import com.flagship.credits_ledger.hold.Hold;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class HoldCreatedEvent implements CreditEvent {
    UUID eventId;
    String organizationId;
    UUID walletId;
    UUID holdId;
    String provider;
    String orderId;
    long amount;
    Instant expiresAt;
    Instant occurredAt;

    public static final String EVENT_TYPE = "HoldCreated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static HoldCreatedEvent fromHold(Hold hold) {
        return new HoldCreatedEvent(
            UUID.randomUUID(),
            hold.getOrganizationId(),
            hold.getWalletId(),
            hold.getId(),
            hold.getProvider(),
            hold.getOrderId(),
            hold.getAmount(),
            hold.getExpiresAt(),
            hold.getCreatedAt()
        );
    }
}

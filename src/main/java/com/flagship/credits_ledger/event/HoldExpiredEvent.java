package com.flagship.credits_ledger.event;

import com.flagship.credits_ledger.hold.Hold;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A hold passed its expiry while still active and no longer reserves funds.
 */
@Value
public class HoldExpiredEvent implements CreditEvent {
    UUID eventId;
    String organizationId;
    UUID walletId;
    UUID holdId;
    String orderId;
    long amount;
    Instant expiresAt;
    Instant occurredAt;

    public static final String EVENT_TYPE = "HoldExpired";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static HoldExpiredEvent fromHold(Hold expired) {
        return new HoldExpiredEvent(
            UUID.randomUUID(),
            expired.getOrganizationId(),
            expired.getWalletId(),
            expired.getId(),
            expired.getOrderId(),
            expired.getAmount(),
            expired.getExpiresAt(),
            expired.getUpdatedAt()
        );
    }
}

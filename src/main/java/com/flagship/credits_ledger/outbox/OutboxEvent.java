package com.flagship.credits_ledger.outbox;

import com.flagship.credits_ledger.event.CreditEvent;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A credit event waiting in (or already relayed from) the outbox table.
 *
 * Written in the same transaction as the ledger or hold change it describes, then
 * relayed to Kafka by {@link OutboxPublisher}.
 */
@Value
public class OutboxEvent {
    UUID id;
    String organizationId;
    String aggregateType;      // always "Wallet" for credit events
    UUID aggregateId;          // wallet id, also the Kafka key
    String eventType;          // e.g. "HoldCaptured"
    String payload;            // JSON payload
    Instant createdAt;
    Instant publishedAt;       // null until relayed
    int retryCount;
    String lastError;
    Long sequenceNumber;

    /**
     * Creates a new unpublished outbox row for a credit event.
     */
    public static OutboxEvent create(CreditEvent event, String payload) {
        return new OutboxEvent(
            event.getEventId(),
            event.getOrganizationId(),
            CreditEvent.AGGREGATE_TYPE,
            event.getWalletId(),
            event.getEventType(),
            payload,
            Instant.now(),
            null,
            0,
            null,
            null   // assigned by the database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean isDeadLettered(int maxRetries) {
        return !isPublished() && retryCount >= maxRetries;
    }
}

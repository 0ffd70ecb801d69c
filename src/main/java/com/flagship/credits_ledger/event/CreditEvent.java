package com.flagship.credits_ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * A committed change to a wallet's ledger or holds, written to the outbox in the
 * same transaction as the change itself.
 *
 * The wallet is the aggregate: events are keyed by wallet id so consumers see each
 * wallet's history in order.
 */
public interface CreditEvent {

    String AGGREGATE_TYPE = "Wallet";

    /**
     * Unique per event instance; consumers deduplicate on it.
     */
    UUID getEventId();

    String getOrganizationId();

    UUID getWalletId();

    Instant getOccurredAt();

    String getEventType();
}

package com.flagship.credits_ledger.wallet;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * The balance-holding identity for one (organization, user, currency) triple.
 *
 * A wallet carries no balance of its own; balances are always derived from the
 * ledger and the wallet's active holds.
 */
@Value
public class Wallet {
    UUID id;
    String organizationId;
    String userId;
    String currency;
    WalletStatus status;
    Instant createdAt;
    Instant updatedAt;

    public boolean isFrozen() {
        return status == WalletStatus.FROZEN;
    }

    /**
     * Returns a copy with the given status.
     */
    public Wallet withStatus(WalletStatus newStatus) {
        if (newStatus == null) {
            throw new IllegalArgumentException("Wallet status is required");
        }
        return new Wallet(id, organizationId, userId, currency, newStatus, createdAt, Instant.now());
    }
}

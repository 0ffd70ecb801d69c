package com.flagship.credits_ledger.operations;

import com.flagship.credits_ledger.ledger.Balances;
import lombok.Value;

import java.util.UUID;

/**
 * Outcome of refunding an order: either its active hold was released, or a REFUND entry
 * was credited. Exactly one of {@code releasedHoldId} and {@code entryId} is set.
 */
@Value
public class RefundResult {
    UUID walletId;
    UUID releasedHoldId;
    UUID entryId;
    Balances balances;

    public boolean isReleased() {
        return releasedHoldId != null;
    }

    static RefundResult released(UUID walletId, UUID holdId, Balances balances) {
        return new RefundResult(walletId, holdId, null, balances);
    }

    static RefundResult credited(UUID walletId, UUID entryId, Balances balances) {
        return new RefundResult(walletId, null, entryId, balances);
    }
}

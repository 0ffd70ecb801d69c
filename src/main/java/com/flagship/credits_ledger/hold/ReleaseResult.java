package com.flagship.credits_ledger.hold;

import com.flagship.credits_ledger.ledger.Balances;
import lombok.Value;

import java.util.UUID;

/**
 * Outcome of a release. When nothing changed (hold missing or already terminal) the
 * wallet and balances are null.
 */
@Value
public class ReleaseResult {
    boolean changed;
    UUID walletId;
    Balances balances;

    public static ReleaseResult unchanged() {
        return new ReleaseResult(false, null, null);
    }

    public static ReleaseResult released(UUID walletId, Balances balances) {
        return new ReleaseResult(true, walletId, balances);
    }
}

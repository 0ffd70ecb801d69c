package com.flagship.credits_ledger.hold;

import com.flagship.credits_ledger.ledger.Balances;
import lombok.Value;

import java.util.UUID;

/**
 * Outcome of a capture: the debited wallet, its balances read after the commit and the
 * id of the CAPTURE entry.
 */
@Value
public class CaptureResult {
    UUID walletId;
    Balances balances;
    UUID ledgerEntryId;
}

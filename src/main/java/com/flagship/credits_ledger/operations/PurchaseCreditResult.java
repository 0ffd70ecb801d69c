package com.flagship.credits_ledger.operations;

import com.flagship.credits_ledger.ledger.Balances;
import lombok.Value;

import java.util.UUID;

@Value
public class PurchaseCreditResult {
    UUID walletId;
    UUID entryId;
    /**
     * False when the idempotency key had already been used and nothing new was credited.
     */
    boolean created;
    Balances balances;
}

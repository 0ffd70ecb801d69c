package com.flagship.credits_ledger.operations;

import com.flagship.credits_ledger.ledger.Balances;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * The hold backing an order. {@code reused} is true when an active hold for the order
 * already existed and was returned instead of reserving again.
 */
@Value
public class OrderHoldResult {
    UUID walletId;
    UUID holdId;
    long amount;
    Instant expiresAt;
    boolean reused;
    Balances balances;
}

package com.flagship.credits_ledger.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * An idempotency key was replayed for a capture, but the entry stored under that key
 * records something else. Applying the capture anyway would drop the hold without a debit.
 */
@Getter
public class IdempotencyKeyConflictException extends ConflictException {

    private final UUID walletId;
    private final String idempotencyKey;

    public IdempotencyKeyConflictException(UUID walletId, String idempotencyKey) {
        super(String.format("Idempotency key %s is already used by a different entry in wallet %s",
                idempotencyKey, walletId));
        this.walletId = walletId;
        this.idempotencyKey = idempotencyKey;
    }
}

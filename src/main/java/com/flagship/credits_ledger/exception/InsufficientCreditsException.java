package com.flagship.credits_ledger.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class InsufficientCreditsException extends ConflictException {

    private final UUID walletId;
    private final long available;
    private final long requested;

    public InsufficientCreditsException(UUID walletId, long available, long requested) {
        super(String.format("Insufficient credits in wallet %s: available=%d, requested=%d",
                walletId, available, requested));
        this.walletId = walletId;
        this.available = available;
        this.requested = requested;
    }
}

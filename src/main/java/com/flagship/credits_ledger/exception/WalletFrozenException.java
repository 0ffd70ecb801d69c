package com.flagship.credits_ledger.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class WalletFrozenException extends ConflictException {

    private final UUID walletId;

    public WalletFrozenException(UUID walletId) {
        super("Wallet is frozen: " + walletId);
        this.walletId = walletId;
    }
}

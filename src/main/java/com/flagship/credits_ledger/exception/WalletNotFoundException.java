package com.flagship.credits_ledger.exception;

import lombok.Getter;

import java.util.UUID;

@Getter
public class WalletNotFoundException extends NotFoundException {

    private final UUID walletId;

    public WalletNotFoundException(UUID walletId) {
        super("Wallet not found: " + walletId);
        this.walletId = walletId;
    }
}

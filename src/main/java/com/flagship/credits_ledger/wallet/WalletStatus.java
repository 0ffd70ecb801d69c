package com.flagship.credits_ledger.wallet;

/**
 * Lifecycle status of a wallet.
 */
public enum WalletStatus {
    /**
     * Accepts credits, debits and new holds.
     */
    ACTIVE,

    /**
     * Readable and creditable, but rejects new holds and debits.
     */
    FROZEN
}

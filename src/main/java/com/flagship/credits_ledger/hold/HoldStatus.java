package com.flagship.credits_ledger.hold;

/**
 * Lifecycle of a hold. ACTIVE is the only state that reserves funds and the only one
 * a hold can leave; the other three are terminal.
 */
public enum HoldStatus {
    ACTIVE,

    /**
     * Realized as a CAPTURE debit in the ledger.
     */
    CAPTURED,

    /**
     * Returned to the wallet without any ledger entry.
     */
    RELEASED,

    /**
     * Passed its expiry while still active. Funds are no longer reserved.
     */
    EXPIRED
}

package com.flagship.credits_ledger.ledger;

/**
 * Side of a ledger entry. Credits add to a wallet's balance, debits subtract from it.
 */
public enum EntryDirection {
    CREDIT,
    DEBIT
}

package com.flagship.credits_ledger.ledger;

import java.util.EnumSet;
import java.util.Set;

/**
 * Why a ledger entry was written. Each reason fixes the directions it may be
 * recorded with; {@link EntryReference#reason()} ties a reference variant to its reason.
 */
public enum LedgerReason {
    /**
     * Credits bought through an external storefront.
     */
    PURCHASE(EnumSet.of(EntryDirection.CREDIT)),

    /**
     * Realization of a hold. Only ever written by hold capture.
     */
    CAPTURE(EnumSet.of(EntryDirection.DEBIT)),

    /**
     * Operator correction in either direction.
     */
    MANUAL_ADJUSTMENT(EnumSet.of(EntryDirection.CREDIT, EntryDirection.DEBIT)),

    /**
     * Credits returned for an order that had already been captured.
     */
    REFUND(EnumSet.of(EntryDirection.CREDIT));

    private final Set<EntryDirection> directions;

    LedgerReason(Set<EntryDirection> directions) {
        this.directions = directions;
    }

    public boolean allows(EntryDirection direction) {
        return directions.contains(direction);
    }
}

package com.flagship.credits_ledger.ledger;

import lombok.Value;

/**
 * Derived balances of one wallet, in minor units.
 *
 * Invariant: {@code balance == available + onHold}, where {@code balance} is everything
 * ever credited minus everything ever debited.
 */
@Value
public class Balances {

    public static final Balances ZERO = new Balances(0, 0, 0);

    long available;
    long onHold;
    long balance;

    public static Balances of(long credited, long debited, long held) {
        long available = credited - debited - held;
        return new Balances(available, held, available + held);
    }

    public boolean covers(long amount) {
        return available >= amount;
    }
}

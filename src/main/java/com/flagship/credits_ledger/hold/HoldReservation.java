package com.flagship.credits_ledger.hold;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class HoldReservation {
    UUID holdId;
    long amount;
    Instant expiresAt;

    /**
     * True when an ACTIVE hold already placed for the order was returned.
     */
    boolean reused;
}

package com.flagship.credits_ledger.exception;

import com.flagship.credits_ledger.hold.HoldStatus;

import java.time.Instant;
import java.util.UUID;

/**
 * Capture reached a hold that was still marked active but whose expiry had passed.
 * The hold is moved to EXPIRED in the same transaction, which still commits.
 */
public class HoldExpiredException extends HoldNotActiveException {

    public HoldExpiredException(UUID holdId, Instant expiresAt) {
        super(holdId, HoldStatus.EXPIRED,
                String.format("Hold %s expired at %s", holdId, expiresAt));
    }
}

package com.flagship.credits_ledger.exception;

/**
 * The target exists but is not in a state that allows the requested change.
 *
 * A conflict on capture usually means another delivery of the same event got there
 * first; callers can treat it as already handled.
 */
public class ConflictException extends IllegalStateException {

    public ConflictException(String message) {
        super(message);
    }
}

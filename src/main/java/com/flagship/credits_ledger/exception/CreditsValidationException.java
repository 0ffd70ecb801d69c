package com.flagship.credits_ledger.exception;

/**
 * A request was malformed (amount, direction, reason, reference, key or TTL).
 * Raised before any store access and never worth retrying unchanged.
 */
public class CreditsValidationException extends IllegalArgumentException {

    public CreditsValidationException(String message) {
        super(message);
    }

    public CreditsValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}

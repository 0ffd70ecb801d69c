package com.flagship.credits_ledger.exception;

/**
 * A wallet, hold or identity mapping the caller referred to does not exist
 * within the caller's organization.
 */
public class NotFoundException extends RuntimeException {

    public NotFoundException(String message) {
        super(message);
    }
}

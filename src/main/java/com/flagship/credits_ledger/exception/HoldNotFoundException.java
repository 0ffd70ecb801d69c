package com.flagship.credits_ledger.exception;

import lombok.Getter;

@Getter
public class HoldNotFoundException extends NotFoundException {

    private final String holdRef;

    private HoldNotFoundException(String holdRef, String message) {
        super(message);
        this.holdRef = holdRef;
    }

    public static HoldNotFoundException forHold(Object holdId) {
        return new HoldNotFoundException(String.valueOf(holdId), "Hold not found: " + holdId);
    }

    public static HoldNotFoundException forOrder(String orderId) {
        return new HoldNotFoundException(orderId, "No active hold for order: " + orderId);
    }
}

package com.flagship.credits_ledger.exception;

import com.flagship.credits_ledger.hold.HoldStatus;
import lombok.Getter;

import java.util.UUID;

@Getter
public class HoldNotActiveException extends ConflictException {

    private final UUID holdId;
    private final HoldStatus status;

    public HoldNotActiveException(UUID holdId, HoldStatus status) {
        this(holdId, status, String.format("Hold %s is not active (status=%s)", holdId, status));
    }

    protected HoldNotActiveException(UUID holdId, HoldStatus status, String message) {
        super(message);
        this.holdId = holdId;
        this.status = status;
    }
}

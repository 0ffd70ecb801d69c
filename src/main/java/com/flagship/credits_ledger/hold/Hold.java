package com.flagship.credits_ledger.hold;

import com.flagship.credits_ledger.exception.CreditsValidationException;
import com.flagship.credits_ledger.exception.HoldNotActiveException;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * A time-boxed reservation of part of a wallet's available credits for one external order.
 *
 * Transitions return a new instance and are only legal from ACTIVE:
 * ACTIVE -> CAPTURED | RELEASED | EXPIRED.
 */
@Value
public class Hold {

    /**
     * Upper bound on a hold's lifetime; keeps expiries inside the range the store can hold.
     */
    public static final Duration MAX_TTL = Duration.ofDays(3650);

    UUID id;
    String organizationId;
    UUID walletId;
    String provider;
    String orderId;
    long amount;
    HoldStatus status;
    Instant expiresAt;
    Instant createdAt;
    Instant updatedAt;

    /**
     * Creates a new ACTIVE hold expiring {@code ttl} after {@code now}.
     *
     * @throws CreditsValidationException if the amount is not positive, the ttl is not within (0, {@link #MAX_TTL}],
     *         or the order is unnamed
     */
    public static Hold create(String organizationId, UUID walletId, String provider, String orderId,
                              long amount, Duration ttl, Instant now) {
        if (organizationId == null || organizationId.isBlank()) {
            throw new CreditsValidationException("Organization id is required");
        }
        if (walletId == null) {
            throw new CreditsValidationException("Wallet id is required");
        }
        if (provider == null || provider.isBlank()) {
            throw new CreditsValidationException("Provider is required");
        }
        if (orderId == null || orderId.isBlank()) {
            throw new CreditsValidationException("Order id is required");
        }
        if (amount <= 0) {
            throw new CreditsValidationException("Hold amount must be positive, got " + amount);
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new CreditsValidationException("Hold ttl must be positive, got " + ttl);
        }
        if (ttl.compareTo(MAX_TTL) > 0) {
            throw new CreditsValidationException("Hold ttl must not exceed " + MAX_TTL.toDays() + " days, got " + ttl);
        }
        return new Hold(
            UUID.randomUUID(),
            organizationId,
            walletId,
            provider,
            orderId,
            amount,
            HoldStatus.ACTIVE,
            now.plus(ttl),
            now,
            now
        );
    }

    public Hold capture() {
        return transitionTo(HoldStatus.CAPTURED);
    }

    public Hold release() {
        return transitionTo(HoldStatus.RELEASED);
    }

    public Hold expire() {
        return transitionTo(HoldStatus.EXPIRED);
    }

    public boolean isActive() {
        return status == HoldStatus.ACTIVE;
    }

    public boolean isTerminal() {
        return status != HoldStatus.ACTIVE;
    }

    /**
     * True when the expiry has been reached at {@code now}; the status is not consulted.
     */
    public boolean isExpiredAt(Instant now) {
        return !now.isBefore(expiresAt);
    }

    public boolean canTransitionTo(HoldStatus targetStatus) {
        return switch (this.status) {
            case ACTIVE -> targetStatus != HoldStatus.ACTIVE;
            case CAPTURED, RELEASED, EXPIRED -> false;
        };
    }

    private Hold transitionTo(HoldStatus targetStatus) {
        if (!canTransitionTo(targetStatus)) {
            throw new HoldNotActiveException(id, status);
        }
        return new Hold(
            id,
            organizationId,
            walletId,
            provider,
            orderId,
            amount,
            targetStatus,
            expiresAt,
            createdAt,
            Instant.now()
        );
    }
}

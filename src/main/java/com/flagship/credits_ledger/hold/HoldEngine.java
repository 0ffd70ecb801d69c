package com.flagship.credits_ledger.hold;

import com.flagship.credits_ledger.config.CreditsProperties;
import com.flagship.credits_ledger.exception.ConflictException;
import com.flagship.credits_ledger.exception.HoldExpiredException;
import com.flagship.credits_ledger.exception.HoldNotFoundException;
import com.flagship.credits_ledger.exception.InsufficientCreditsException;
import com.flagship.credits_ledger.ledger.BalanceCalculator;
import com.flagship.credits_ledger.ledger.Balances;
import com.flagship.credits_ledger.observability.CreditMetrics;
import com.flagship.credits_ledger.observability.MdcScope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Reserve, capture, release and expire holds on wallet credits.
 *
 * Each state change runs in its own transaction in {@link HoldPersistenceService}; this
 * class adds logging context and metrics, and reads balances once the change has committed
 * so callers always see the post-change state.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HoldEngine {

    private final HoldPersistenceService persistenceService;
    private final BalanceCalculator balanceCalculator;
    private final CreditsProperties properties;
    private final CreditMetrics metrics;

    /**
     * Reserves {@code amount} of the wallet's available credits for an order.
     *
     * @throws com.flagship.credits_ledger.exception.CreditsValidationException if amount or ttl is not positive
     * @throws com.flagship.credits_ledger.exception.WalletNotFoundException if the wallet does not exist
     * @throws com.flagship.credits_ledger.exception.WalletFrozenException if the wallet is frozen
     * @throws InsufficientCreditsException if available credits do not cover the amount
     */
    public HoldReservation createHold(String organizationId, UUID walletId, String provider, String orderId,
                                      long amount, long ttlSeconds) {
        return reserve(organizationId, walletId, provider, orderId, amount, ttlSeconds, false);
    }

    /**
     * Like {@link #createHold}, but returns the order's ACTIVE hold when one exists instead of
     * reserving again. Repeated or concurrent calls for one order leave a single ACTIVE hold.
     */
    public HoldReservation reserveForOrder(String organizationId, UUID walletId, String provider, String orderId,
                                           long amount, long ttlSeconds) {
        return reserve(organizationId, walletId, provider, orderId, amount, ttlSeconds, true);
    }

    private HoldReservation reserve(String organizationId, UUID walletId, String provider, String orderId,
                                    long amount, long ttlSeconds, boolean reuseActiveOrderHold) {
        long startTime = System.currentTimeMillis();
        MdcScope walletScope = MdcScope.put("walletId", walletId);
        try {
            HoldPersistenceService.ReservedHold reserved = persistenceService.create(
                organizationId, walletId, provider, orderId, amount, ttlSeconds, reuseActiveOrderHold);
            Hold hold = reserved.getHold();
            if (reserved.isReused()) {
                log.debug("Reusing active hold for order: holdId={}, orderId={}", hold.getId(), orderId);
            } else {
                metrics.recordHoldTransition(HoldStatus.ACTIVE.name());
                log.info("Hold created: holdId={}, orderId={}, amount={}, expiresAt={}",
                        hold.getId(), orderId, amount, hold.getExpiresAt());
            }
            return new HoldReservation(hold.getId(), hold.getAmount(), hold.getExpiresAt(), reserved.isReused());
        } catch (ConflictException e) {
            metrics.recordConflict(conflictType(e));
            log.warn("Hold rejected: orderId={}, amount={}, reason={}", orderId, amount, e.getMessage());
            throw e;
        } finally {
            metrics.recordLatency("create_hold", System.currentTimeMillis() - startTime);
            walletScope.close();
        }
    }

    /**
     * Captures an active hold as a DEBIT/CAPTURE ledger entry.
     *
     * @throws HoldNotFoundException if the hold does not exist in the organization
     * @throws com.flagship.credits_ledger.exception.HoldNotActiveException if the hold is terminal or has expired
     * @throws com.flagship.credits_ledger.exception.IdempotencyKeyConflictException if the key already names a different entry
     */
    public CaptureResult captureHold(String organizationId, UUID holdId, String idempotencyKey) {
        long startTime = System.currentTimeMillis();
        MdcScope holdScope = MdcScope.put("holdId", holdId);
        try {
            HoldPersistenceService.CapturedHold captured =
                persistenceService.capture(organizationId, holdId, idempotencyKey);
            Hold hold = captured.getHold();
            metrics.recordHoldTransition(HoldStatus.CAPTURED.name());

            Balances balances = balanceCalculator.getBalances(organizationId, hold.getWalletId());
            log.info("Hold captured: walletId={}, amount={}, ledgerEntryId={}",
                    hold.getWalletId(), hold.getAmount(), captured.getLedgerEntryId());
            return new CaptureResult(hold.getWalletId(), balances, captured.getLedgerEntryId());
        } catch (HoldExpiredException e) {
            metrics.recordHoldTransition(HoldStatus.EXPIRED.name());
            metrics.recordConflict(conflictType(e));
            log.warn("Capture rejected: {}", e.getMessage());
            throw e;
        } catch (ConflictException e) {
            metrics.recordConflict(conflictType(e));
            log.warn("Capture rejected: {}", e.getMessage());
            throw e;
        } finally {
            metrics.recordLatency("capture_hold", System.currentTimeMillis() - startTime);
            holdScope.close();
        }
    }

    /**
     * Releases an active hold. Releasing a missing or terminal hold changes nothing and is
     * not an error.
     */
    public ReleaseResult releaseHold(String organizationId, UUID holdId) {
        long startTime = System.currentTimeMillis();
        MdcScope holdScope = MdcScope.put("holdId", holdId);
        try {
            Optional<Hold> released = persistenceService.release(organizationId, holdId);
            if (released.isEmpty()) {
                log.debug("Release was a no-op: hold missing or not active");
                return ReleaseResult.unchanged();
            }
            Hold hold = released.get();
            metrics.recordHoldTransition(HoldStatus.RELEASED.name());
            log.info("Hold released: walletId={}, amount={}", hold.getWalletId(), hold.getAmount());
            return ReleaseResult.released(hold.getWalletId(),
                balanceCalculator.getBalances(organizationId, hold.getWalletId()));
        } finally {
            metrics.recordLatency("release_hold", System.currentTimeMillis() - startTime);
            holdScope.close();
        }
    }

    public Optional<Hold> findActiveHoldByOrder(String organizationId, UUID walletId, String orderId) {
        return persistenceService.findActiveHoldByOrder(organizationId, walletId, orderId);
    }

    public Optional<Hold> findHold(String organizationId, UUID holdId) {
        return persistenceService.findHold(organizationId, holdId);
    }

    /**
     * Moves every ACTIVE hold past its expiry to EXPIRED, one batch per transaction.
     *
     * @return number of holds expired by this call
     */
    public int expireDueHolds() {
        int batchSize = properties.getHolds().getExpiry().getBatchSize();
        int total = 0;
        List<Hold> batch;
        do {
            batch = persistenceService.expireBatch(batchSize);
            total += batch.size();
            batch.forEach(hold -> log.info("Hold expired: holdId={}, walletId={}, amount={}",
                    hold.getId(), hold.getWalletId(), hold.getAmount()));
        } while (batch.size() == batchSize);

        metrics.recordHoldTransitions(HoldStatus.EXPIRED.name(), total);
        return total;
    }

    private static String conflictType(ConflictException e) {
        return e.getClass().getSimpleName().replace("Exception", "");
    }
}

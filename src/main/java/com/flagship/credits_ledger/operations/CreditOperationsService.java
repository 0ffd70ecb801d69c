package com.flagship.credits_ledger.operations;

import com.flagship.credits_ledger.config.CreditsProperties;
import com.flagship.credits_ledger.exception.CreditsValidationException;
import com.flagship.credits_ledger.exception.HoldNotFoundException;
import com.flagship.credits_ledger.exception.IdentityNotFoundException;
import com.flagship.credits_ledger.hold.CaptureResult;
import com.flagship.credits_ledger.hold.Hold;
import com.flagship.credits_ledger.hold.HoldEngine;
import com.flagship.credits_ledger.hold.HoldReservation;
import com.flagship.credits_ledger.hold.ReleaseResult;
import com.flagship.credits_ledger.identity.ExternalIdentityResolver;
import com.flagship.credits_ledger.ledger.BalanceCalculator;
import com.flagship.credits_ledger.ledger.EntryDirection;
import com.flagship.credits_ledger.ledger.EntryReference;
import com.flagship.credits_ledger.ledger.LedgerLog;
import com.flagship.credits_ledger.ledger.LedgerReason;
import com.flagship.credits_ledger.ledger.RecordedEntry;
import com.flagship.credits_ledger.money.MoneyCodec;
import com.flagship.credits_ledger.wallet.Wallet;
import com.flagship.credits_ledger.wallet.WalletDirectory;
import com.flagship.credits_ledger.observability.MdcScope;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Order-level credit flows for an external storefront, addressed by the provider's user id.
 *
 * Each step (identity lookup, wallet resolution, ledger or hold change) commits on its own.
 * Every step is idempotent or get-or-create, so a failed call can be repeated as a whole.
 * An expired hold found at capture stays EXPIRED even though the capture call fails.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CreditOperationsService {

    private final ExternalIdentityResolver identityResolver;
    private final WalletDirectory walletDirectory;
    private final LedgerLog ledgerLog;
    private final BalanceCalculator balanceCalculator;
    private final HoldEngine holdEngine;
    private final CreditsProperties properties;

    /**
     * Credits a storefront purchase of credits to the buyer's wallet.
     *
     * @throws IdentityNotFoundException if the provider user is not linked to a user
     */
    public PurchaseCreditResult creditPurchase(String organizationId, String provider, String providerUserId,
                                               String orderId, BigDecimal amount, String idempotencyKey) {
        long amountMinor = MoneyCodec.toMinorUnits(amount);
        Wallet wallet = resolveWallet(organizationId, provider, providerUserId);

        MdcScope walletScope = MdcScope.put("walletId", wallet.getId());
        try {
            RecordedEntry recorded = ledgerLog.insertLedgerEntry(
                organizationId,
                wallet.getId(),
                EntryDirection.CREDIT,
                amountMinor,
                LedgerReason.PURCHASE,
                new EntryReference.Purchase(provider, orderId),
                idempotencyKey
            );
            log.info("Purchase credited: orderId={}, amount={}, created={}",
                    orderId, MoneyCodec.toDecimalString(amountMinor), recorded.isCreated());
            return new PurchaseCreditResult(wallet.getId(), recorded.getId(), recorded.isCreated(),
                balanceCalculator.getBalances(organizationId, wallet.getId()));
        } finally {
            walletScope.close();
        }
    }

    /**
     * Reserves credits for an order. An order that already has an active hold gets that
     * hold back unchanged.
     *
     * @param ttlSeconds null for the configured default; otherwise within the configured range
     */
    public OrderHoldResult placeOrderHold(String organizationId, String provider, String providerUserId,
                                          String orderId, BigDecimal amount, Integer ttlSeconds) {
        long amountMinor = MoneyCodec.toMinorUnits(amount);
        int ttl = resolveTtl(ttlSeconds);
        Wallet wallet = resolveWallet(organizationId, provider, providerUserId);

        HoldReservation reservation = holdEngine.reserveForOrder(
            organizationId, wallet.getId(), provider, orderId, amountMinor, ttl);
        if (reservation.isReused() && reservation.getAmount() != amountMinor) {
            log.warn("Order already holds a different amount, reusing it: orderId={}, held={}, requested={}",
                    orderId, reservation.getAmount(), amountMinor);
        }
        return new OrderHoldResult(wallet.getId(), reservation.getHoldId(), reservation.getAmount(),
            reservation.getExpiresAt(), reservation.isReused(),
            balanceCalculator.getBalances(organizationId, wallet.getId()));
    }

    /**
     * Captures the active hold of an order.
     *
     * @throws HoldNotFoundException if the order has no active hold
     */
    public CaptureResult captureOrderHold(String organizationId, String provider, String providerUserId,
                                          String orderId, String idempotencyKey) {
        Wallet wallet = resolveWallet(organizationId, provider, providerUserId);
        Hold hold = holdEngine.findActiveHoldByOrder(organizationId, wallet.getId(), orderId)
            .orElseThrow(() -> HoldNotFoundException.forOrder(orderId));
        return holdEngine.captureHold(organizationId, hold.getId(), idempotencyKey);
    }

    /**
     * Refunds an order. If its hold is still active nothing was debited, so the hold is
     * released; otherwise {@code amount} is credited back as a REFUND entry.
     */
    public RefundResult refundOrder(String organizationId, String provider, String providerUserId,
                                    String orderId, BigDecimal amount, String note, String idempotencyKey) {
        Wallet wallet = resolveWallet(organizationId, provider, providerUserId);

        Optional<Hold> active = holdEngine.findActiveHoldByOrder(organizationId, wallet.getId(), orderId);
        if (active.isPresent()) {
            ReleaseResult release = holdEngine.releaseHold(organizationId, active.get().getId());
            if (release.isChanged()) {
                log.info("Refund released active hold: orderId={}, holdId={}", orderId, active.get().getId());
                return RefundResult.released(wallet.getId(), active.get().getId(), release.getBalances());
            }
            // Captured or expired between the lookup and the release: refund as a credit.
            log.debug("Active hold changed before release, crediting instead: orderId={}", orderId);
        }

        long amountMinor = MoneyCodec.toMinorUnits(amount);
        RecordedEntry recorded = ledgerLog.insertLedgerEntry(
            organizationId,
            wallet.getId(),
            EntryDirection.CREDIT,
            amountMinor,
            LedgerReason.REFUND,
            new EntryReference.Refund(provider, orderId, note),
            idempotencyKey
        );
        log.info("Refund credited: orderId={}, amount={}, created={}",
                orderId, MoneyCodec.toDecimalString(amountMinor), recorded.isCreated());
        return RefundResult.credited(wallet.getId(), recorded.getId(),
            balanceCalculator.getBalances(organizationId, wallet.getId()));
    }

    private Wallet resolveWallet(String organizationId, String provider, String providerUserId) {
        String userId = identityResolver.findUserIdByExternalIdentity(organizationId, provider, providerUserId)
            .orElseThrow(() -> new IdentityNotFoundException(provider, providerUserId));
        return walletDirectory.ensureWallet(organizationId, userId);
    }

    private int resolveTtl(Integer ttlSeconds) {
        CreditsProperties.Holds holds = properties.getHolds();
        if (ttlSeconds == null) {
            return holds.getDefaultTtlSeconds();
        }
        if (ttlSeconds < holds.getMinTtlSeconds() || ttlSeconds > holds.getMaxTtlSeconds()) {
            throw new CreditsValidationException(String.format(
                "Hold ttl must be between %d and %d seconds, got %d",
                holds.getMinTtlSeconds(), holds.getMaxTtlSeconds(), ttlSeconds));
        }
        return ttlSeconds;
    }
}

package com.flagship.credits_ledger.hold;

import com.flagship.credits_ledger.config.LockTimeout;
import com.flagship.credits_ledger.event.HoldCapturedEvent;
import com.flagship.credits_ledger.event.HoldCreatedEvent;
import com.flagship.credits_ledger.event.HoldExpiredEvent;
import com.flagship.credits_ledger.event.HoldReleasedEvent;
import com.flagship.credits_ledger.exception.HoldExpiredException;
import com.flagship.credits_ledger.exception.HoldNotActiveException;
import com.flagship.credits_ledger.exception.HoldNotFoundException;
import com.flagship.credits_ledger.exception.IdempotencyKeyConflictException;
import com.flagship.credits_ledger.exception.InsufficientCreditsException;
import com.flagship.credits_ledger.exception.WalletFrozenException;
import com.flagship.credits_ledger.ledger.BalanceCalculator;
import com.flagship.credits_ledger.ledger.Balances;
import com.flagship.credits_ledger.ledger.EntryReference;
import com.flagship.credits_ledger.ledger.LedgerEntry;
import com.flagship.credits_ledger.ledger.LedgerEntryRequest;
import com.flagship.credits_ledger.ledger.LedgerLog;
import com.flagship.credits_ledger.ledger.RecordedEntry;
import com.flagship.credits_ledger.outbox.OutboxService;
import com.flagship.credits_ledger.wallet.Wallet;
import com.flagship.credits_ledger.wallet.WalletDirectory;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Transactional hold state changes. Every method is one transaction that writes the row
 * change, any ledger entry and the outbox event together.
 */
@Service
@RequiredArgsConstructor
@Slf4j
class HoldPersistenceService {

    private final HoldRepository holdRepository;
    private final WalletDirectory walletDirectory;
    private final BalanceCalculator balanceCalculator;
    private final LedgerLog ledgerLog;
    private final OutboxService outboxService;
    private final LockTimeout lockTimeout;

    /**
     * Reserves funds under the wallet row lock. Hold creation and debits on the same wallet
     * serialize on that lock, so two holds cannot both pass the availability check against
     * the same credits.
     *
     * With {@code reuseActiveOrderHold} an ACTIVE hold already placed for the order is
     * returned instead of a new one. The lookup runs under the same lock, so concurrent
     * requests for one order leave exactly one ACTIVE hold.
     */
    @Transactional
    public ReservedHold create(String organizationId, UUID walletId, String provider, String orderId,
                               long amount, long ttlSeconds, boolean reuseActiveOrderHold) {
        Hold hold = Hold.create(organizationId, walletId, provider, orderId, amount,
            Duration.ofSeconds(ttlSeconds), Instant.now());

        Wallet wallet = walletDirectory.lockWallet(organizationId, walletId);
        if (reuseActiveOrderHold) {
            Optional<Hold> existing = findActiveHoldByOrder(organizationId, walletId, orderId);
            if (existing.isPresent()) {
                return new ReservedHold(existing.get(), true);
            }
        }
        if (wallet.isFrozen()) {
            throw new WalletFrozenException(walletId);
        }

        Balances balances = balanceCalculator.getBalances(organizationId, walletId);
        if (!balances.covers(amount)) {
            throw new InsufficientCreditsException(walletId, balances.getAvailable(), amount);
        }

        Hold saved = holdRepository.saveAndFlush(HoldEntity.fromDomain(hold)).toDomain();
        outboxService.saveEvent(HoldCreatedEvent.fromHold(saved));
        return new ReservedHold(saved, false);
    }

    /**
     * Debits the held amount and marks the hold CAPTURED.
     *
     * A hold still ACTIVE past its expiry is moved to EXPIRED and {@link HoldExpiredException}
     * is thrown; that transition and its event are committed.
     */
    @Transactional(noRollbackFor = HoldExpiredException.class)
    public CapturedHold capture(String organizationId, UUID holdId, String idempotencyKey) {
        lockTimeout.apply();
        HoldEntity entity = holdRepository.findForUpdate(organizationId, holdId)
            .orElseThrow(() -> HoldNotFoundException.forHold(holdId));
        Hold hold = entity.toDomain();

        if (!hold.isActive()) {
            throw new HoldNotActiveException(holdId, hold.getStatus());
        }

        if (hold.isExpiredAt(Instant.now())) {
            Hold expired = applyTransition(entity, hold.expire());
            outboxService.saveEvent(HoldExpiredEvent.fromHold(expired));
            log.info("Hold expired at capture: holdId={}, expiresAt={}", holdId, hold.getExpiresAt());
            throw new HoldExpiredException(holdId, hold.getExpiresAt());
        }

        LedgerEntryRequest request = LedgerEntryRequest.capture(
            organizationId,
            hold.getWalletId(),
            hold.getAmount(),
            new EntryReference.Capture(hold.getProvider(), hold.getOrderId(), holdId),
            idempotencyKey
        );
        RecordedEntry recorded = ledgerLog.append(request);
        if (!recorded.isCreated()) {
            Optional<LedgerEntry> stored = ledgerLog.findEntryByKey(hold.getWalletId(), idempotencyKey);
            if (stored.isEmpty() || !request.matches(stored.get())) {
                throw new IdempotencyKeyConflictException(hold.getWalletId(), idempotencyKey);
            }
        }

        Hold captured = applyTransition(entity, hold.capture());
        outboxService.saveEvent(HoldCapturedEvent.fromHold(captured, recorded.getId()));
        return new CapturedHold(captured, recorded.getId());
    }

    /**
     * Conditional ACTIVE -> RELEASED. Empty when the hold is missing or already terminal.
     * An expired hold that the sweep has not reached yet is still released.
     */
    @Transactional
    public Optional<Hold> release(String organizationId, UUID holdId) {
        lockTimeout.apply();
        int updated = holdRepository.releaseIfActive(
            organizationId, holdId, Instant.now(), HoldStatus.ACTIVE, HoldStatus.RELEASED);
        if (updated == 0) {
            return Optional.empty();
        }

        Hold released = holdRepository.findByOrganizationIdAndId(organizationId, holdId)
            .map(HoldEntity::toDomain)
            .orElseThrow(() -> HoldNotFoundException.forHold(holdId));
        outboxService.saveEvent(HoldReleasedEvent.fromHold(released));
        return Optional.of(released);
    }

    /**
     * Expires one batch of due holds and returns them.
     */
    @Transactional
    public List<Hold> expireBatch(int batchSize) {
        List<HoldEntity> due = holdRepository.findDueForUpdate(Instant.now(), batchSize);
        List<Hold> expired = due.stream()
            .map(entity -> applyTransition(entity, entity.toDomain().expire()))
            .toList();
        expired.forEach(hold -> outboxService.saveEvent(HoldExpiredEvent.fromHold(hold)));
        return expired;
    }

    @Transactional(readOnly = true)
    public Optional<Hold> findHold(String organizationId, UUID holdId) {
        return holdRepository.findByOrganizationIdAndId(organizationId, holdId)
            .map(HoldEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<Hold> findActiveHoldByOrder(String organizationId, UUID walletId, String orderId) {
        return holdRepository
            .findFirstByOrganizationIdAndWalletIdAndOrderIdAndStatusOrderByCreatedAtDesc(
                organizationId, walletId, orderId, HoldStatus.ACTIVE)
            .map(HoldEntity::toDomain);
    }

    private Hold applyTransition(HoldEntity entity, Hold transitioned) {
        entity.updateFromDomain(transitioned);
        return holdRepository.saveAndFlush(entity).toDomain();
    }

    @Value
    static class ReservedHold {
        Hold hold;
        boolean reused;
    }

    @Value
    static class CapturedHold {
        Hold hold;
        UUID ledgerEntryId;
    }
}

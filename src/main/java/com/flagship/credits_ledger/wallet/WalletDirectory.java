package com.flagship.credits_ledger.wallet;

import com.flagship.credits_ledger.config.CreditsProperties;
import com.flagship.credits_ledger.config.LockTimeout;
import com.flagship.credits_ledger.exception.CreditsValidationException;
import com.flagship.credits_ledger.exception.WalletNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Resolves or creates the single wallet of an (organization, user, currency) triple.
 *
 * Creation relies on the unique constraint over the identity triple: the insert is
 * {@code ON CONFLICT DO NOTHING}, so when two requests race on a brand-new user the
 * loser's insert is a no-op and both read back the same row.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WalletDirectory {

    private final JdbcTemplate jdbcTemplate;
    private final WalletRepository walletRepository;
    private final CreditsProperties properties;
    private final LockTimeout lockTimeout;

    /**
     * Returns the wallet of the given user, creating an ACTIVE one on first reference.
     *
     * @param organizationId tenant the user belongs to
     * @param userId internal user id owning the wallet
     * @return the one wallet for this identity
     */
    @Transactional
    public Wallet ensureWallet(String organizationId, String userId) {
        requireText(organizationId, "Organization id");
        requireText(userId, "User id");
        String currency = properties.getCurrency();

        Optional<WalletEntity> existing =
            walletRepository.findByOrganizationIdAndUserIdAndCurrency(organizationId, userId, currency);
        if (existing.isPresent()) {
            return existing.get().toDomain();
        }

        Timestamp now = Timestamp.from(Instant.now());
        int inserted = jdbcTemplate.update(
            "INSERT INTO credit_wallets (id, organization_id, user_id, currency, status, created_at, updated_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?) " +
            "ON CONFLICT (organization_id, user_id, currency) DO NOTHING",
            UUID.randomUUID(),
            organizationId,
            userId,
            currency,
            WalletStatus.ACTIVE.name(),
            now,
            now
        );

        Wallet wallet = walletRepository.findByOrganizationIdAndUserIdAndCurrency(organizationId, userId, currency)
            .map(WalletEntity::toDomain)
            .orElseThrow(() -> new IllegalStateException(
                "Wallet missing after insert for user " + userId + " in organization " + organizationId));

        if (inserted == 1) {
            log.info("Created wallet: walletId={}, organizationId={}, userId={}",
                    wallet.getId(), organizationId, userId);
        } else {
            log.debug("Wallet created concurrently, using existing: walletId={}", wallet.getId());
        }
        return wallet;
    }

    @Transactional(readOnly = true)
    public Optional<Wallet> findWallet(String organizationId, UUID walletId) {
        return walletRepository.findByOrganizationIdAndId(organizationId, walletId)
            .map(WalletEntity::toDomain);
    }

    /**
     * Freezes or unfreezes a wallet. Existing holds are untouched; a frozen wallet
     * only refuses new holds and debits.
     */
    @Transactional
    public Wallet updateStatus(String organizationId, UUID walletId, WalletStatus status) {
        if (status == null) {
            throw new CreditsValidationException("Wallet status is required");
        }
        lockTimeout.apply();
        WalletEntity entity = walletRepository.findForUpdate(organizationId, walletId)
            .orElseThrow(() -> new WalletNotFoundException(walletId));

        Wallet current = entity.toDomain();
        if (current.getStatus() == status) {
            return current;
        }
        entity.updateFromDomain(current.withStatus(status));
        WalletEntity saved = walletRepository.saveAndFlush(entity);
        log.info("Wallet status changed: walletId={}, from={}, to={}", walletId, current.getStatus(), status);
        return saved.toDomain();
    }

    /**
     * Loads the wallet under an exclusive row lock held until the caller's transaction ends.
     *
     * @throws WalletNotFoundException if the wallet does not exist in the organization
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Wallet lockWallet(String organizationId, UUID walletId) {
        lockTimeout.apply();
        return walletRepository.findForUpdate(organizationId, walletId)
            .map(WalletEntity::toDomain)
            .orElseThrow(() -> new WalletNotFoundException(walletId));
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new CreditsValidationException(name + " is required");
        }
    }
}

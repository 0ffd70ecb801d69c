package com.flagship.credits_ledger.wallet;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface WalletRepository extends JpaRepository<WalletEntity, UUID> {

    Optional<WalletEntity> findByOrganizationIdAndUserIdAndCurrency(
        String organizationId, String userId, String currency);

    Optional<WalletEntity> findByOrganizationIdAndId(String organizationId, UUID id);

    /**
     * Loads a wallet and takes an exclusive row lock until the surrounding
     * transaction ends. Serializes hold creation and debits per wallet.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT w FROM WalletEntity w WHERE w.organizationId = :organizationId AND w.id = :id")
    Optional<WalletEntity> findForUpdate(@Param("organizationId") String organizationId,
                                         @Param("id") UUID id);
}

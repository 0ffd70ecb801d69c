package com.flagship.credits_ledger.hold;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface HoldRepository extends JpaRepository<HoldEntity, UUID> {

    Optional<HoldEntity> findByOrganizationIdAndId(String organizationId, UUID id);

    Optional<HoldEntity> findFirstByOrganizationIdAndWalletIdAndOrderIdAndStatusOrderByCreatedAtDesc(
        String organizationId, UUID walletId, String orderId, HoldStatus status);

    /**
     * Loads a hold under an exclusive row lock. Two captures of the same hold serialize here
     * and the second sees the first one's terminal status.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT h FROM HoldEntity h WHERE h.organizationId = :organizationId AND h.id = :id")
    Optional<HoldEntity> findForUpdate(@Param("organizationId") String organizationId,
                                       @Param("id") UUID id);

    /**
     * Conditional ACTIVE -> RELEASED. Returns 0 when the hold is missing or already terminal.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
        UPDATE HoldEntity h SET h.status = :released, h.updatedAt = :now
        WHERE h.organizationId = :organizationId AND h.id = :id AND h.status = :active
        """)
    int releaseIfActive(@Param("organizationId") String organizationId,
                        @Param("id") UUID id,
                        @Param("now") Instant now,
                        @Param("active") HoldStatus active,
                        @Param("released") HoldStatus released);

    /**
     * Active holds whose expiry has passed, oldest first. Rows held by a concurrent capture
     * or sweep are skipped and picked up by a later run.
     */
    @Query(value = """
        SELECT * FROM credit_holds
        WHERE status = 'ACTIVE' AND expires_at <= :now
        ORDER BY expires_at ASC
        LIMIT :limit
        FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    List<HoldEntity> findDueForUpdate(@Param("now") Instant now, @Param("limit") int limit);
}

package com.flagship.credits_ledger.wallet;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA mapping of the credit_wallets table.
 *
 * Rows are inserted by {@link WalletDirectory} with an ON CONFLICT insert so that
 * concurrent first use of a user cannot create two wallets. Through JPA a wallet is
 * only read, locked, and have its status changed.
 */
@Entity
@Table(
    name = "credit_wallets",
    uniqueConstraints = @UniqueConstraint(
        name = "uq_credit_wallets_identity",
        columnNames = {"organization_id", "user_id", "currency"})
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class WalletEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "organization_id", nullable = false, updatable = false)
    private String organizationId;

    @Column(name = "user_id", nullable = false, updatable = false)
    private String userId;

    @Column(nullable = false, updatable = false, length = 16)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private WalletStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    public Wallet toDomain() {
        return new Wallet(id, organizationId, userId, currency, status, createdAt, updatedAt);
    }

    /**
     * Only the status of a wallet is mutable; identity columns never change.
     */
    void updateFromDomain(Wallet wallet) {
        this.status = wallet.getStatus();
    }
}

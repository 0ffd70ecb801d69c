package com.flagship.credits_ledger.hold;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA mapping of credit_holds.
 *
 * No setters: a hold row changes only through {@link #updateFromDomain(Hold)}, which
 * copies the status of a domain transition. Everything else is fixed at creation.
 */
@Entity
@Table(
    name = "credit_holds",
    indexes = {
        @Index(name = "idx_credit_holds_order", columnList = "organization_id, wallet_id, order_id, status"),
        @Index(name = "idx_credit_holds_active_expiry", columnList = "status, expires_at")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class HoldEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "organization_id", nullable = false, updatable = false)
    private String organizationId;

    @Column(name = "wallet_id", nullable = false, updatable = false)
    private UUID walletId;

    @Column(nullable = false, updatable = false)
    private String provider;

    @Column(name = "order_id", nullable = false, updatable = false)
    private String orderId;

    @Column(nullable = false, updatable = false)
    private long amount;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private HoldStatus status;

    @Column(name = "expires_at", nullable = false, updatable = false)
    private Instant expiresAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static HoldEntity fromDomain(Hold hold) {
        return new HoldEntity(
            hold.getId(),
            hold.getOrganizationId(),
            hold.getWalletId(),
            hold.getProvider(),
            hold.getOrderId(),
            hold.getAmount(),
            hold.getStatus(),
            hold.getExpiresAt(),
            hold.getCreatedAt(),
            hold.getUpdatedAt()
        );
    }

    public Hold toDomain() {
        return new Hold(
            id,
            organizationId,
            walletId,
            provider,
            orderId,
            amount,
            status,
            expiresAt,
            createdAt,
            updatedAt
        );
    }

    void updateFromDomain(Hold hold) {
        this.status = hold.getStatus();
        this.updatedAt = hold.getUpdatedAt();
    }
}

package com.flagship.credits_ledger.identity;

import lombok.Value;

import java.time.Instant;

/**
 * Maps a user id issued by an external provider to the internal user that owns a wallet.
 */
@Value
public class ExternalIdentity {
    String organizationId;
    String provider;
    String providerUserId;
    String userId;
    String email;
    Instant createdAt;
    Instant updatedAt;
}

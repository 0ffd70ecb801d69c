package com.flagship.credits_ledger.identity;

import com.flagship.credits_ledger.exception.CreditsValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Resolves (organization, provider, provider user id) to an internal user id.
 *
 * A mapping, once created, keeps pointing at the same user. Upserting it again only
 * refreshes the email, and only when a new one is given.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExternalIdentityResolver {

    private static final String IDENTITY_COLUMNS =
        "organization_id, provider, provider_user_id, user_id, email, created_at, updated_at";

    private final JdbcTemplate jdbcTemplate;

    @Transactional(readOnly = true)
    public Optional<String> findUserIdByExternalIdentity(String organizationId, String provider,
                                                         String providerUserId) {
        return findIdentity(organizationId, provider, providerUserId).map(ExternalIdentity::getUserId);
    }

    @Transactional(readOnly = true)
    public Optional<ExternalIdentity> findIdentity(String organizationId, String provider, String providerUserId) {
        return jdbcTemplate.query(
            "SELECT " + IDENTITY_COLUMNS + " FROM credit_external_identities " +
            "WHERE organization_id = ? AND provider = ? AND provider_user_id = ?",
            identityRowMapper(),
            organizationId,
            provider,
            providerUserId
        ).stream().findFirst();
    }

    /**
     * Creates the mapping, or refreshes the email of an existing one.
     *
     * @param email optional; null leaves a stored email unchanged
     * @return the stored mapping, whose user id may differ from {@code userId} if it already existed
     */
    @Transactional
    public ExternalIdentity upsertExternalIdentity(String organizationId, String userId, String provider,
                                                   String providerUserId, String email) {
        requireText(organizationId, "Organization id");
        requireText(userId, "User id");
        requireText(provider, "Provider");
        requireText(providerUserId, "Provider user id");

        Timestamp now = Timestamp.from(Instant.now());
        ExternalIdentity stored = jdbcTemplate.queryForObject(
            "INSERT INTO credit_external_identities " +
            "(id, organization_id, provider, provider_user_id, user_id, email, created_at, updated_at) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?, ?) " +
            "ON CONFLICT (organization_id, provider, provider_user_id) DO UPDATE SET " +
            "  email = COALESCE(EXCLUDED.email, credit_external_identities.email), " +
            "  updated_at = EXCLUDED.updated_at " +
            "RETURNING " + IDENTITY_COLUMNS,
            identityRowMapper(),
            UUID.randomUUID(),
            organizationId,
            provider,
            providerUserId,
            userId,
            email,
            now,
            now
        );

        if (stored != null && !stored.getUserId().equals(userId)) {
            log.warn("External identity already mapped to another user, keeping it: provider={}, " +
                    "providerUserId={}, mappedUserId={}, requestedUserId={}",
                    provider, providerUserId, stored.getUserId(), userId);
        } else {
            log.debug("Upserted external identity: provider={}, providerUserId={}, userId={}",
                    provider, providerUserId, userId);
        }
        return stored;
    }

    private RowMapper<ExternalIdentity> identityRowMapper() {
        return (rs, rowNum) -> new ExternalIdentity(
            rs.getString("organization_id"),
            rs.getString("provider"),
            rs.getString("provider_user_id"),
            rs.getString("user_id"),
            rs.getString("email"),
            rs.getTimestamp("created_at").toInstant(),
            rs.getTimestamp("updated_at").toInstant()
        );
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new CreditsValidationException(name + " is required");
        }
    }
}

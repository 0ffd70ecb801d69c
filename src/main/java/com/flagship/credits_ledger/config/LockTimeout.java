package com.flagship.credits_ledger.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Bounds how long the current transaction may wait on a row lock.
 *
 * Uses PostgreSQL's transaction-scoped {@code SET LOCAL lock_timeout}; once the bound is
 * hit the driver reports SQLSTATE 55P03, which Spring translates to
 * {@link org.springframework.dao.CannotAcquireLockException}. That exception is transient:
 * every mutating operation here is idempotent, so the caller may retry the whole call.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LockTimeout {

    private final JdbcTemplate jdbcTemplate;
    private final CreditsProperties properties;

    /**
     * Must run inside the transaction that will take the lock.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void apply() {
        long timeoutMs = properties.getLockTimeoutMs();
        if (timeoutMs <= 0) {
            return;
        }
        // SET does not accept bind parameters; the value is a long from configuration.
        jdbcTemplate.execute("SET LOCAL lock_timeout = " + timeoutMs);
        log.trace("Applied lock_timeout={}ms", timeoutMs);
    }
}

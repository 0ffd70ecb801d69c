package com.flagship.credits_ledger.ledger;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Derives wallet balances from the ledger and the active holds. Nothing is stored or cached.
 */
@Service
@RequiredArgsConstructor
public class BalanceCalculator {

    private final JdbcTemplate jdbcTemplate;

    /**
     * Computes the balances of a wallet.
     *
     * The three aggregates (credits, debits, active holds) are scalar subqueries of one
     * statement, so they read one snapshot even when this joins a READ COMMITTED caller
     * such as hold creation. A capture committing concurrently moves an amount from
     * on-hold to debited and is seen either entirely or not at all.
     * An unknown wallet yields {@link Balances#ZERO}.
     */
    @Transactional(readOnly = true, isolation = Isolation.REPEATABLE_READ)
    public Balances getBalances(String organizationId, UUID walletId) {
        Balances balances = jdbcTemplate.queryForObject(
            "SELECT " +
            "  (SELECT COALESCE(SUM(amount), 0) FROM credit_ledger_entries " +
            "     WHERE organization_id = ? AND wallet_id = ? AND direction = 'CREDIT') AS credited, " +
            "  (SELECT COALESCE(SUM(amount), 0) FROM credit_ledger_entries " +
            "     WHERE organization_id = ? AND wallet_id = ? AND direction = 'DEBIT') AS debited, " +
            "  (SELECT COALESCE(SUM(amount), 0) FROM credit_holds " +
            "     WHERE organization_id = ? AND wallet_id = ? AND status = 'ACTIVE') AS held",
            (rs, rowNum) -> Balances.of(rs.getLong("credited"), rs.getLong("debited"), rs.getLong("held")),
            organizationId, walletId,
            organizationId, walletId,
            organizationId, walletId
        );
        return balances != null ? balances : Balances.ZERO;
    }
}

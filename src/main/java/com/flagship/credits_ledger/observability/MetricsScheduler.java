package com.flagship.credits_ledger.observability;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Refreshes gauges that need a database query.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final CreditMetrics creditMetrics;
    private final JdbcTemplate jdbcTemplate;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshOutboxMetrics() {
        outboxMetrics.refreshMetrics();
    }

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshHoldMetrics() {
        try {
            jdbcTemplate.query(
                "SELECT COUNT(*) AS holds, COALESCE(SUM(amount), 0) AS reserved " +
                "FROM credit_holds WHERE status = 'ACTIVE'",
                rs -> {
                    creditMetrics.updateActiveHolds(rs.getLong("holds"), rs.getLong("reserved"));
                }
            );
        } catch (Exception e) {
            log.warn("Failed to refresh hold metrics: {}", e.getMessage());
        }
    }
}

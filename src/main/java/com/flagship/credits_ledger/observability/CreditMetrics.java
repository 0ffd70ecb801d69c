package com.flagship.credits_ledger.observability;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer meters for the ledger and the hold engine.
 *
 * Metrics exposed:
 * - credits.ledger.entries: entries appended, tagged by direction, reason and outcome
 *   (created or replayed)
 * - credits.holds.transitions: hold state changes, tagged by target status
 * - credits.conflicts: rejected transitions, tagged by type
 * - credits.operation.latency: timer per engine operation
 * - credits.holds.active: gauge, refreshed by {@link MetricsScheduler}
 */
@Component
public class CreditMetrics {

    private final MeterRegistry registry;
    private final AtomicLong activeHolds = new AtomicLong(0);
    private final AtomicLong activeHoldAmount = new AtomicLong(0);

    public CreditMetrics(MeterRegistry registry) {
        this.registry = registry;

        Gauge.builder("credits.holds.active", activeHolds, AtomicLong::get)
                .description("Number of holds currently reserving funds")
                .register(registry);

        Gauge.builder("credits.holds.active.amount", activeHoldAmount, AtomicLong::get)
                .description("Minor units currently reserved by active holds")
                .register(registry);
    }

    public void recordLedgerEntry(String direction, String reason, boolean created) {
        registry.counter("credits.ledger.entries",
                "direction", sanitizeTag(direction),
                "reason", sanitizeTag(reason),
                "outcome", created ? "created" : "replayed"
        ).increment();
    }

    public void recordHoldTransition(String status) {
        registry.counter("credits.holds.transitions",
                "status", sanitizeTag(status)
        ).increment();
    }

    public void recordHoldTransitions(String status, int count) {
        if (count > 0) {
            registry.counter("credits.holds.transitions",
                    "status", sanitizeTag(status)
            ).increment(count);
        }
    }

    public void recordConflict(String type) {
        registry.counter("credits.conflicts",
                "type", sanitizeTag(type)
        ).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("credits.operation.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    void updateActiveHolds(long count, long amount) {
        activeHolds.set(count);
        activeHoldAmount.set(amount);
    }

    private String sanitizeTag(String value) {
        if (value == null || value.isBlank()) {
            return "unknown";
        }
        return value.toLowerCase().replaceAll("[^a-z0-9_]", "_");
    }
}

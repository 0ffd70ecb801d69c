package com.flagship.credits_ledger.health;

import com.flagship.credits_ledger.observability.OutboxMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unauthenticated liveness/readiness probe. The service is ready when the ledger database
 * answers; the outbox backlog is reported but never fails the probe.
 */
@RestController
@Slf4j
public class HealthController {

    private final DataSource dataSource;
    private final OutboxMetrics outboxMetrics;

    public HealthController(DataSource dataSource, OutboxMetrics outboxMetrics) {
        this.dataSource = dataSource;
        this.outboxMetrics = outboxMetrics;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        boolean databaseUp = checkDatabase();

        response.put("status", databaseUp ? "UP" : "DOWN");
        response.put("timestamp", Instant.now().toString());
        response.put("database", databaseUp ? "UP" : "DOWN");
        response.put("outboxBacklog", outboxMetrics.getBacklogSize());

        if (!databaseUp) {
            return ResponseEntity.status(503).body(response);
        }
        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (SQLException e) {
            log.warn("Health probe could not reach the database: {}", e.getMessage());
            return false;
        }
    }
}

package com.flagship.credits_ledger.hold;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically expires holds whose expiry has passed, so they stop counting as on-hold
 * without waiting for a capture attempt.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "credits.holds.expiry.enabled", havingValue = "true", matchIfMissing = true)
public class HoldExpiryScheduler {

    private final HoldEngine holdEngine;

    @Scheduled(fixedDelayString = "${credits.holds.expiry.interval-ms:30000}")
    public void expireDueHolds() {
        try {
            int expired = holdEngine.expireDueHolds();
            if (expired > 0) {
                log.info("Hold expiry sweep finished: expired={}", expired);
            }
        } catch (Exception e) {
            log.error("Hold expiry sweep failed", e);
        }
    }
}

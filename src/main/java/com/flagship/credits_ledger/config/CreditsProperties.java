package com.flagship.credits_ledger.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Service-level settings for wallets, holds and lock waits.
 */
@Component
@ConfigurationProperties(prefix = "credits")
@Getter
@Setter
public class CreditsProperties {

    /**
     * The single currency unit every wallet is opened in.
     */
    private String currency = "GEMS";

    /**
     * Upper bound on how long a transaction waits for a wallet or hold row lock.
     * Zero disables the bound.
     */
    private long lockTimeoutMs = 5000;

    private Holds holds = new Holds();

    @Getter
    @Setter
    public static class Holds {

        private int defaultTtlSeconds = 900;

        private int minTtlSeconds = 60;

        private int maxTtlSeconds = 3600;

        private Expiry expiry = new Expiry();
    }

    @Getter
    @Setter
    public static class Expiry {

        private boolean enabled = true;

        private long intervalMs = 30000;

        private int batchSize = 200;

        public void setBatchSize(int batchSize) {
            if (batchSize <= 0) {
                throw new IllegalArgumentException("credits.holds.expiry.batch-size must be positive, got " + batchSize);
            }
            this.batchSize = batchSize;
        }
    }
}

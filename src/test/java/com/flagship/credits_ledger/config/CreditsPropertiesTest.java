package com.flagship.credits_ledger.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CreditsPropertiesTest {

    @Test
    @DisplayName("Expiry batch size must be positive")
    void rejectsNonPositiveBatchSize() {
        CreditsProperties.Expiry expiry = new CreditsProperties().getHolds().getExpiry();

        assertThrows(IllegalArgumentException.class, () -> expiry.setBatchSize(0));
        assertThrows(IllegalArgumentException.class, () -> expiry.setBatchSize(-1));
        assertEquals(200, expiry.getBatchSize());

        expiry.setBatchSize(50);
        assertEquals(50, expiry.getBatchSize());
    }
}

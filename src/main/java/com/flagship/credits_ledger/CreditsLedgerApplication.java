package com.flagship.credits_ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Entry point for the credits ledger service.
 *
 * Hosts the wallet directory, the append-only ledger, the hold engine and the
 * order-level credit operations built on top of them.
 */
@SpringBootApplication
@EnableScheduling
public class CreditsLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(CreditsLedgerApplication.class, args);
    }
}

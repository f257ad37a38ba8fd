package com.paymentengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for the Payment Engine.
 *
 * Payment Engine moves money for a services marketplace: recurring booking charges
 * with retry and reconciliation, cancellation refunds, and provider payouts out of
 * escrow, all recorded in one append-only ledger.
 */
@SpringBootApplication
@EnableScheduling
public class PaymentEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(PaymentEngineApplication.class, args);
    }
}

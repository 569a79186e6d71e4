package com.fintech.checkoutsync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Checkout Reconciliation Service
 * <p>
 * Keeps locally recorded gateway checkouts in line with the payment gateway and
 * repairs orders whose payment failed locally although the gateway settled it.
 */
@SpringBootApplication
@EnableScheduling
@EnableRetry
public class CheckoutReconciliationApplication {

    public static void main(String[] args) {
        SpringApplication.run(CheckoutReconciliationApplication.class, args);
    }
}

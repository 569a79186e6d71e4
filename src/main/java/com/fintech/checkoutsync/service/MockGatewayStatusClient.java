package com.fintech.checkoutsync.service;

import com.fintech.checkoutsync.config.ResilienceConfig;
import com.fintech.checkoutsync.dto.GatewayTransaction;
import com.fintech.checkoutsync.exception.GatewayUnavailableException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory stand-in for the payment gateway.
 * <p>
 * Simulates network latency, intermittent failures and full outages so the
 * reconciliation run can be exercised without a gateway sandbox.
 */
@Service
@Slf4j
public class MockGatewayStatusClient implements GatewayStatusClient {

    private static final String GATEWAY_NAME = "MockBraintree";

    private final Map<String, GatewayTransaction> transactions = new ConcurrentHashMap<>();

    private final Random random = new Random();

    @Value("${gateway.mock.failure-rate:0.1}")
    private double failureRate;

    @Value("${gateway.mock.latency-ms:50}")
    private int latencyMs;

    private volatile boolean simulateOutage = false;

    public MockGatewayStatusClient() {
        initializeMockData();
    }

    private void initializeMockData() {
        addMockTransaction("txn-001", "authorized", new BigDecimal("100.00"), "USD");
        addMockTransaction("txn-002", "submitted_for_settlement", new BigDecimal("250.50"), "USD");
        addMockTransaction("txn-003", "settling", new BigDecimal("42.00"), "EUR");
        addMockTransaction("txn-004", "settled", new BigDecimal("1000.00"), "USD");
        addMockTransaction("txn-005", "processor_declined", new BigDecimal("75.00"), "USD");
        addMockTransaction("txn-006", "voided", new BigDecimal("200.00"), "GBP");

        log.info("Mock gateway initialized with {} transactions", transactions.size());
    }

    private void addMockTransaction(String transactionId, String status,
                                    BigDecimal amount, String currency) {
        transactions.put(transactionId, GatewayTransaction.builder()
                .transactionId(transactionId)
                .status(status)
                .amount(amount)
                .currencyIsoCode(currency)
                .updatedAt(LocalDateTime.now())
                .build());
    }

    @Override
    @CircuitBreaker(name = ResilienceConfig.GATEWAY_CIRCUIT_BREAKER, fallbackMethod = "findTransactionFallback")
    @Retryable(
            retryFor = GatewayUnavailableException.class,
            exceptionExpression = "retryable",
            maxAttemptsExpression = "${gateway.retry.max-attempts:3}",
            backoff = @Backoff(delayExpression = "${gateway.retry.delay-ms:1000}", multiplier = 2)
    )
    public GatewayTransaction findTransaction(String transactionId) throws GatewayUnavailableException {
        log.debug("Looking up gateway transaction {}", transactionId);

        simulateLatency();

        if (simulateOutage) {
            throw new GatewayUnavailableException(
                    "Gateway API is currently unavailable", GATEWAY_NAME, transactionId, true);
        }

        if (random.nextDouble() < failureRate) {
            throw new GatewayUnavailableException(
                    "Simulated network failure while contacting gateway", GATEWAY_NAME, transactionId, true);
        }

        GatewayTransaction transaction = transactions.get(transactionId);
        if (transaction == null) {
            throw new GatewayUnavailableException(
                    "Transaction not found on gateway: " + transactionId, GATEWAY_NAME, transactionId, false);
        }

        log.debug("Gateway reports status {} for transaction {}", transaction.getStatus(), transactionId);
        return transaction;
    }

    /**
     * Called when the circuit is open or the call failed; rethrows as a gateway error
     * so the caller records it and moves on.
     */
    public GatewayTransaction findTransactionFallback(String transactionId, Throwable throwable) {
        log.warn("Circuit breaker fallback for transaction {}: {}", transactionId, throwable.getMessage());

        if (throwable instanceof GatewayUnavailableException) {
            throw (GatewayUnavailableException) throwable;
        }
        throw new GatewayUnavailableException(
                "Gateway circuit breaker is open. Service temporarily unavailable.",
                GATEWAY_NAME, transactionId, true);
    }

    private void simulateLatency() {
        if (latencyMs > 0) {
            try {
                Thread.sleep(random.nextInt(latencyMs));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @Override
    public String getGatewayName() {
        return GATEWAY_NAME;
    }

    @Override
    public boolean isAvailable() {
        return !simulateOutage;
    }

    // Simulation controls

    public void putTransaction(String transactionId, String status, BigDecimal amount, String currency) {
        addMockTransaction(transactionId, status, amount, currency);
    }

    /**
     * Changes the status the gateway reports, keeping the amount.
     */
    public void updateTransactionStatus(String transactionId, String newStatus) {
        GatewayTransaction existing = transactions.get(transactionId);
        if (existing != null) {
            transactions.put(transactionId, GatewayTransaction.builder()
                    .transactionId(transactionId)
                    .status(newStatus)
                    .amount(existing.getAmount())
                    .currencyIsoCode(existing.getCurrencyIsoCode())
                    .updatedAt(LocalDateTime.now())
                    .build());
        }
    }

    public void setSimulateOutage(boolean outage) {
        this.simulateOutage = outage;
        log.info("Gateway outage simulation set to: {}", outage);
    }

    public void clearMockData() {
        transactions.clear();
    }
}

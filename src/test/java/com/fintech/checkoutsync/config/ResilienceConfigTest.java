package com.fintech.checkoutsync.config;

import com.fintech.checkoutsync.exception.GatewayUnavailableException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ResilienceConfigTest {

    private CircuitBreaker circuitBreaker;

    @BeforeEach
    void setUp() {
        circuitBreaker = new ResilienceConfig().circuitBreakerRegistry()
                .circuitBreaker(ResilienceConfig.GATEWAY_CIRCUIT_BREAKER);
    }

    @Test
    void shouldTreatOnlyNonRetryableGatewayErrorsAsPermanent() {
        assertThat(ResilienceConfig.isPermanentGatewayError(
                new GatewayUnavailableException("not found", "MockBraintree", "txn-1", false))).isTrue();
        assertThat(ResilienceConfig.isPermanentGatewayError(
                new GatewayUnavailableException("timeout", "MockBraintree", "txn-1"))).isFalse();
        assertThat(ResilienceConfig.isPermanentGatewayError(new IllegalStateException("boom"))).isFalse();
    }

    @Test
    @DisplayName("A run of unknown transaction ids does not open the circuit")
    void shouldStayClosedOnPermanentErrors() {
        for (int i = 0; i < 25; i++) {
            circuitBreaker.onError(0, TimeUnit.MILLISECONDS,
                    new GatewayUnavailableException("not found", "MockBraintree", "missing-" + i, false));
        }

        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.CLOSED);
        assertThat(circuitBreaker.getMetrics().getNumberOfFailedCalls()).isZero();
    }

    @Test
    @DisplayName("Transient gateway errors still open the circuit")
    void shouldOpenOnTransientErrors() {
        for (int i = 0; i < 20; i++) {
            circuitBreaker.onError(0, TimeUnit.MILLISECONDS,
                    new GatewayUnavailableException("timeout", "MockBraintree", "txn-" + i));
        }

        assertThat(circuitBreaker.getState()).isEqualTo(CircuitBreaker.State.OPEN);
    }
}

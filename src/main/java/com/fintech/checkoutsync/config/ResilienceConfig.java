package com.fintech.checkoutsync.config;

import com.fintech.checkoutsync.exception.GatewayUnavailableException;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Circuit breaker guarding gateway lookups.
 * <p>
 * When the gateway keeps failing the circuit opens and lookups fail fast; the
 * scan records those checkouts as errors and they are retried on the next run.
 * <p>
 * Lookups that can never succeed, such as an unknown transaction id, say nothing
 * about gateway health and are not counted as failures.
 */
@Configuration
public class ResilienceConfig {

    public static final String GATEWAY_CIRCUIT_BREAKER = "gatewayApi";

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                .slidingWindowSize(20)
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .permittedNumberOfCallsInHalfOpenState(3)
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                .ignoreException(ResilienceConfig::isPermanentGatewayError)
                .build();

        return CircuitBreakerRegistry.of(config);
    }

    static boolean isPermanentGatewayError(Throwable throwable) {
        return throwable instanceof GatewayUnavailableException
                && !((GatewayUnavailableException) throwable).isRetryable();
    }
}

package com.fintech.checkoutsync.service;

import com.fintech.checkoutsync.dto.VaultedPaymentMethod;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory payment method registry with a single vault-backed gateway method.
 */
@Service
@Slf4j
public class MockPaymentMethodRegistry implements PaymentMethodRegistry {

    public static final Long DEFAULT_PAYMENT_METHOD_ID = 1L;

    private final Map<String, VaultedPaymentMethod> vault = new ConcurrentHashMap<>();

    private final PaymentMethodGateway gateway = token -> {
        if (token == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(vault.get(token));
    };

    public MockPaymentMethodRegistry() {
        vault.put("vault-card-visa", VaultedPaymentMethod.builder()
                .cardType("Visa").last4("1881").build());
        vault.put("vault-card-amex", VaultedPaymentMethod.builder()
                .cardType("AmericanExpress").last4("0005").build());
        vault.put("vault-paypal", VaultedPaymentMethod.builder()
                .email("buyer@example.com").build());
    }

    @Override
    public Optional<PaymentMethodGateway> find(Long paymentMethodId) {
        if (!DEFAULT_PAYMENT_METHOD_ID.equals(paymentMethodId)) {
            return Optional.empty();
        }
        return Optional.of(gateway);
    }

    public void putVaultedPaymentMethod(String token, VaultedPaymentMethod method) {
        vault.put(token, method);
        log.debug("Vaulted payment method stored under token {}", token);
    }
}

package com.fintech.checkoutsync.service;

import com.fintech.checkoutsync.dto.VaultedPaymentMethod;

import java.util.Optional;

/**
 * Gateway client bound to a configured payment method.
 */
public interface PaymentMethodGateway {

    /**
     * Looks up a vaulted payment method by its token.
     */
    Optional<VaultedPaymentMethod> vaultedPaymentMethod(String token);
}

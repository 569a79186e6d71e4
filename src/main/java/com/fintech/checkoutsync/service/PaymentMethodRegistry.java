package com.fintech.checkoutsync.service;

import java.util.Optional;

/**
 * Resolves configured payment methods to their gateway clients.
 */
public interface PaymentMethodRegistry {

    Optional<PaymentMethodGateway> find(Long paymentMethodId);
}

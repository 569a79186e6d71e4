package com.fintech.checkoutsync.service;

import com.fintech.checkoutsync.dto.CheckoutParams;
import com.fintech.checkoutsync.dto.VaultedPaymentMethod;
import com.fintech.checkoutsync.entity.Checkout;
import com.fintech.checkoutsync.exception.PaymentMethodNotFoundException;
import com.fintech.checkoutsync.repository.CheckoutRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Creates checkouts, either from the drop-in form's tokenization parameters or
 * from a payment method already stored in the gateway vault.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CheckoutFactory {

    private final CheckoutRepository checkoutRepository;
    private final PaymentMethodRegistry paymentMethodRegistry;

    @Transactional
    public Checkout createFromParams(CheckoutParams params) {
        Checkout checkout = Checkout.builder()
                .paypalEmail(params.getPaypalEmail())
                .braintreeLastDigits(params.getBraintreeLastTwo())
                .braintreeCardType(StateMapper.mapCardType(params.getBraintreeCardType()))
                .build();
        Checkout saved = checkoutRepository.save(checkout);
        log.debug("Created checkout {} from form parameters", saved.getId());
        return saved;
    }

    /**
     * @throws PaymentMethodNotFoundException if no payment method has the given id
     */
    @Transactional
    public Checkout createFromToken(String token, Long paymentMethodId) {
        PaymentMethodGateway gateway = paymentMethodRegistry.find(paymentMethodId)
                .orElseThrow(() -> new PaymentMethodNotFoundException(paymentMethodId));

        VaultedPaymentMethod vaulted = gateway.vaultedPaymentMethod(token)
                .orElseGet(VaultedPaymentMethod::new);
        if (vaulted.getCardType() == null && vaulted.getEmail() == null) {
            log.warn("No vaulted payment data for token on payment method {}", paymentMethodId);
        }

        Checkout checkout = Checkout.builder()
                .paypalEmail(vaulted.emailIfPresent().orElse(null))
                .braintreeLastDigits(vaulted.last4IfPresent().orElse(null))
                .braintreeCardType(StateMapper.mapCardType(vaulted.cardTypeIfPresent().orElse(null)))
                .build();
        Checkout saved = checkoutRepository.save(checkout);
        log.debug("Created checkout {} from vaulted payment method", saved.getId());
        return saved;
    }
}

package com.fintech.checkoutsync.service;

import com.fintech.checkoutsync.entity.Checkout;
import com.fintech.checkoutsync.entity.CheckoutState;
import com.fintech.checkoutsync.entity.Payment;
import com.fintech.checkoutsync.entity.PaymentAction;
import com.fintech.checkoutsync.repository.PaymentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Carries a persisted checkout state change over to the linked payment.
 * <p>
 * Must be called once, right after the new checkout state has been saved.
 * This is the only place a checkout state change mutates a payment.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentStateReconciler {

    private final PaymentRepository paymentRepository;

    /**
     * Applies the payment action implied by the checkout's new state.
     *
     * @param checkout      the checkout, already saved in its new state
     * @param previousState the state it held before that save
     * @return the action fired, or empty if the state did not change, there is no
     *         linked payment, the payment is already where the action leads, or
     *         the payment's state does not allow the action
     */
    public Optional<PaymentAction> reconcile(Checkout checkout, CheckoutState previousState) {
        CheckoutState newState = checkout.getState();
        if (previousState == newState) {
            return Optional.empty();
        }

        Optional<Payment> linked = paymentRepository.findByCheckoutId(checkout.getId());
        if (linked.isEmpty()) {
            log.debug("Checkout {} moved {} -> {} but funds no payment", checkout.getId(), previousState, newState);
            return Optional.empty();
        }

        Payment payment = linked.get();
        PaymentAction action = StateMapper.mapCheckoutStateToAction(newState);
        if (payment.getState() == action.getTarget()) {
            log.debug("Payment {} already {} for checkout {} ({} -> {})",
                    payment.getId(), payment.getState(), checkout.getId(), previousState, newState);
            return Optional.empty();
        }
        if (!payment.apply(action)) {
            log.warn("Payment {} in state {} refused action '{}' for checkout {} ({} -> {})",
                    payment.getId(), payment.getState(), action.getCode(), checkout.getId(), previousState, newState);
            return Optional.empty();
        }

        paymentRepository.save(payment);
        log.info("Payment {} -> {} via '{}' after checkout {} moved {} -> {}",
                payment.getId(), payment.getState(), action.getCode(), checkout.getId(), previousState, newState);
        return Optional.of(action);
    }
}

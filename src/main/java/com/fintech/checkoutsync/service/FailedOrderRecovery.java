package com.fintech.checkoutsync.service;

import com.fintech.checkoutsync.dto.GatewayTransaction;
import com.fintech.checkoutsync.entity.Checkout;
import com.fintech.checkoutsync.entity.CheckoutState;
import com.fintech.checkoutsync.entity.Order;
import com.fintech.checkoutsync.entity.Payment;
import com.fintech.checkoutsync.repository.PaymentRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Completes orders whose payment failed locally while the gateway went on to settle it.
 * <p>
 * Some PayPal transactions take long enough to authorize that the storefront
 * gives up and fails the payment, yet the gateway settles them later. For those
 * the payment is reopened as pending and completed only when the order total,
 * the payment amount and the gateway amount all agree.
 */
@Service
@Slf4j
public class FailedOrderRecovery {

    private final PaymentRepository paymentRepository;
    private final GatewayStatusClient gatewayClient;
    private final ShipmentSynchronizer shipmentSynchronizer;
    private final TransactionTemplate transactionTemplate;

    public FailedOrderRecovery(PaymentRepository paymentRepository,
                               GatewayStatusClient gatewayClient,
                               ShipmentSynchronizer shipmentSynchronizer,
                               PlatformTransactionManager transactionManager) {
        this.paymentRepository = paymentRepository;
        this.gatewayClient = gatewayClient;
        this.shipmentSynchronizer = shipmentSynchronizer;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    /**
     * Recovers one candidate checkout.
     * <p>
     * The payment transition commits on its own before shipments are resynced,
     * so a resync failure propagates to the caller without undoing the repair.
     */
    public RecoveryOutcome recover(Checkout checkout) {
        Optional<Payment> linked = paymentRepository.findByCheckoutId(checkout.getId());
        if (linked.isEmpty() || !isFailedOrderWithSettledCheckout(checkout, linked.get())) {
            return RecoveryOutcome.SKIPPED;
        }
        Order order = linked.get().getOrder();

        // The local settled flag may be stale by now, ask the gateway again
        GatewayTransaction transaction = gatewayClient.findTransaction(checkout.getTransactionId());

        RecoveryOutcome outcome;
        if (!CheckoutState.SETTLED.getCode().equals(transaction.getStatus())) {
            log.warn("Checkout {} is settled locally but gateway reports '{}'; payment {} stays failed",
                    checkout.getId(), transaction.getStatus(), linked.get().getId());
            outcome = RecoveryOutcome.NOT_CONFIRMED;
        } else {
            outcome = transactionTemplate.execute(status -> repairPayment(checkout, transaction));
            if (outcome == RecoveryOutcome.SKIPPED) {
                return outcome;
            }
        }

        shipmentSynchronizer.resync(order);
        return outcome;
    }

    private RecoveryOutcome repairPayment(Checkout checkout, GatewayTransaction transaction) {
        // Reload: the payment may have moved since the candidate was selected
        Payment payment = paymentRepository.findByCheckoutId(checkout.getId())
                .filter(Payment::isFailed)
                .orElse(null);
        if (payment == null) {
            log.info("Payment for checkout {} is no longer failed, nothing to recover", checkout.getId());
            return RecoveryOutcome.SKIPPED;
        }
        Order order = payment.getOrder();

        payment.reopen();
        paymentRepository.save(payment);

        if (amountsMatch(order.getTotal(), payment.getAmount(), transaction.getAmount())) {
            payment.completeAfterRecovery();
            paymentRepository.save(payment);
            log.info("Recovered payment {} of order {} as completed", payment.getId(), order.getNumber());
            return RecoveryOutcome.COMPLETED;
        }

        log.warn("Payment {} of order {} reopened as pending: order total {}, payment {}, gateway {}",
                payment.getId(), order.getNumber(), order.getTotal(), payment.getAmount(),
                transaction.getAmount());
        return RecoveryOutcome.PENDING_AMOUNT_MISMATCH;
    }

    /**
     * The drift being repaired: payment failed here, checkout settled there.
     */
    public boolean isFailedOrderWithSettledCheckout(Checkout checkout, Payment payment) {
        return payment != null && payment.isFailed() && checkout.getState() == CheckoutState.SETTLED;
    }

    /**
     * True if all amounts are present and numerically equal, ignoring scale.
     */
    static boolean amountsMatch(BigDecimal... amounts) {
        Set<BigDecimal> distinct = new HashSet<>();
        for (BigDecimal amount : amounts) {
            if (amount == null) {
                return false;
            }
            distinct.add(amount.stripTrailingZeros());
        }
        return distinct.size() == 1;
    }
}

package com.fintech.checkoutsync.service;

import com.fintech.checkoutsync.dto.GatewayTransaction;
import com.fintech.checkoutsync.entity.Checkout;
import com.fintech.checkoutsync.entity.CheckoutState;
import com.fintech.checkoutsync.repository.CheckoutRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Refreshes a single checkout against the gateway.
 * <p>
 * The gateway is asked before any transaction is opened. Persisting the new
 * state and updating the payment then run in one transaction, so a failure at
 * either step leaves the checkout as it was and eligible for the next scan.
 */
@Service
@Slf4j
public class CheckoutStateRefresher {

    private final CheckoutRepository checkoutRepository;
    private final GatewayStatusClient gatewayClient;
    private final PaymentStateReconciler paymentStateReconciler;
    private final TransactionTemplate transactionTemplate;

    public CheckoutStateRefresher(CheckoutRepository checkoutRepository,
                                  GatewayStatusClient gatewayClient,
                                  PaymentStateReconciler paymentStateReconciler,
                                  PlatformTransactionManager transactionManager) {
        this.checkoutRepository = checkoutRepository;
        this.gatewayClient = gatewayClient;
        this.paymentStateReconciler = paymentStateReconciler;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
    }

    /**
     * @return true if the gateway reported a different state and it was saved
     */
    public boolean refresh(Checkout checkout) {
        log.debug("Refreshing checkout {} with transaction {}", checkout.getId(), checkout.getTransactionId());

        GatewayTransaction transaction = gatewayClient.findTransaction(checkout.getTransactionId());
        CheckoutState observed = StateMapper.parseGatewayStatus(transaction.getStatus());

        if (observed == checkout.getState()) {
            return false;
        }

        transactionTemplate.executeWithoutResult(status -> {
            CheckoutState previous = checkout.updateState(observed);
            Checkout saved = checkoutRepository.saveAndFlush(checkout);

            log.info("Checkout {} moved {} -> {} (gateway status '{}')",
                    saved.getId(), previous, observed, transaction.getStatus());

            paymentStateReconciler.reconcile(saved, previous);
        });
        return true;
    }
}

package com.fintech.checkoutsync.service;

import com.fintech.checkoutsync.dto.ReconciliationResult;
import com.fintech.checkoutsync.entity.Checkout;
import com.fintech.checkoutsync.entity.CheckoutState;
import com.fintech.checkoutsync.entity.PaymentState;
import com.fintech.checkoutsync.exception.GatewayUnavailableException;
import com.fintech.checkoutsync.exception.ReconciliationException;
import com.fintech.checkoutsync.repository.CheckoutRepository;
import com.fintech.checkoutsync.repository.PaymentRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Brings local checkouts in line with the payment gateway.
 * <p>
 * A run scans every checkout that is not in a final state, refreshes each one
 * against the gateway, then repairs recent PayPal orders whose payment failed
 * locally although the gateway settled it.
 * <p>
 * Each checkout is processed on its own: a gateway or persistence failure is
 * counted and logged, and the scan moves on. Rerunning is always safe, final
 * checkouts are never selected again and unchanged ones cause no writes.
 */
@Service
@Slf4j
public class ReconciliationService {

    private static final String STAGE_SCAN = "scan";
    private static final String STAGE_RECOVERY = "recovery";

    private final CheckoutRepository checkoutRepository;
    private final PaymentRepository paymentRepository;
    private final CheckoutStateRefresher checkoutStateRefresher;
    private final FailedOrderRecovery failedOrderRecovery;
    private final MeterRegistry meterRegistry;

    @Value("${reconciliation.batch-size:100}")
    private int batchSize = 100;

    @Value("${reconciliation.recovery.window-hours:48}")
    private int recoveryWindowHours = 48;

    private Counter scannedCounter;
    private Counter changedCounter;
    private Counter unchangedCounter;
    private Counter gatewayErrorCounter;
    private Counter failureCounter;
    private Counter recoveredCompletedCounter;
    private Counter recoveredPendingCounter;
    private Timer reconciliationTimer;

    // Prevents concurrent reconciliation runs
    private final AtomicBoolean isRunning = new AtomicBoolean(false);

    public ReconciliationService(CheckoutRepository checkoutRepository,
                                 PaymentRepository paymentRepository,
                                 CheckoutStateRefresher checkoutStateRefresher,
                                 FailedOrderRecovery failedOrderRecovery,
                                 MeterRegistry meterRegistry) {
        this.checkoutRepository = checkoutRepository;
        this.paymentRepository = paymentRepository;
        this.checkoutStateRefresher = checkoutStateRefresher;
        this.failedOrderRecovery = failedOrderRecovery;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        scannedCounter = Counter.builder("reconciliation.checkouts.total")
                .description("Checkouts refreshed against the gateway")
                .register(meterRegistry);

        changedCounter = Counter.builder("reconciliation.checkouts.changed")
                .description("Checkouts whose gateway status differed from the stored state")
                .register(meterRegistry);

        unchangedCounter = Counter.builder("reconciliation.checkouts.unchanged")
                .description("Checkouts already in line with the gateway")
                .register(meterRegistry);

        gatewayErrorCounter = Counter.builder("reconciliation.gateway.errors")
                .description("Errors communicating with the payment gateway")
                .register(meterRegistry);

        failureCounter = Counter.builder("reconciliation.checkouts.failure")
                .description("Checkouts that could not be reconciled for other reasons")
                .register(meterRegistry);

        recoveredCompletedCounter = Counter.builder("reconciliation.recovery.completed")
                .description("Failed payments recovered as completed")
                .register(meterRegistry);

        recoveredPendingCounter = Counter.builder("reconciliation.recovery.pending")
                .description("Failed payments reopened as pending on an amount mismatch")
                .register(meterRegistry);

        reconciliationTimer = Timer.builder("reconciliation.duration")
                .description("Time taken to complete a reconciliation run")
                .register(meterRegistry);
    }

    /**
     * Runs a full reconciliation: checkout scan, then failed order recovery.
     *
     * @return counts of changed and unchanged checkouts, recovery outcomes and errors
     * @throws ReconciliationException if a run is already in progress
     */
    public ReconciliationResult updateStates() {
        if (!isRunning.compareAndSet(false, true)) {
            log.warn("Reconciliation already in progress, skipping this run");
            throw new ReconciliationException("Reconciliation already in progress");
        }

        ReconciliationResult result = ReconciliationResult.builder()
                .startedAt(LocalDateTime.now())
                .build();

        log.info("Starting checkout reconciliation");

        try {
            return reconciliationTimer.record(() -> {
                scanOpenCheckouts(result);
                completeFailedOrdersWithSettledCheckout(result);
                result.setCompletedAt(LocalDateTime.now());

                log.info("Reconciliation completed. Processed: {}, Changed: {}, Unchanged: {}, " +
                                "Recovered completed: {}, Recovered pending: {}, Errors: {}",
                        result.getTotalProcessed(),
                        result.getChanged(),
                        result.getUnchanged(),
                        result.getRecoveredCompleted(),
                        result.getRecoveredPending(),
                        result.getErrors());

                return result;
            });
        } finally {
            isRunning.set(false);
        }
    }

    private void scanOpenCheckouts(ReconciliationResult result) {
        long lastId = 0L;
        int batchNumber = 0;
        List<Checkout> batch;

        do {
            batch = checkoutRepository.findOpenCheckoutsAfter(
                    CheckoutState.finalStates(), lastId, PageRequest.of(0, batchSize));

            log.debug("Processing batch {} with {} checkouts", batchNumber, batch.size());

            for (Checkout checkout : batch) {
                processCheckout(checkout, result);
                lastId = checkout.getId();
            }
            batchNumber++;
        } while (batch.size() == batchSize);
    }

    private void processCheckout(Checkout checkout, ReconciliationResult result) {
        result.setTotalProcessed(result.getTotalProcessed() + 1);
        scannedCounter.increment();

        try {
            if (checkoutStateRefresher.refresh(checkout)) {
                result.incrementChanged();
                changedCounter.increment();
            } else {
                result.incrementUnchanged();
                unchangedCounter.increment();
            }
        } catch (GatewayUnavailableException e) {
            log.warn("Gateway error for checkout {}: {}", checkout.getId(), e.getMessage());
            gatewayErrorCounter.increment();
            result.addError(checkout.getId(), checkout.getTransactionId(), STAGE_SCAN, e.getMessage());
        } catch (Exception e) {
            log.error("Unexpected error reconciling checkout {}: {}", checkout.getId(), e.getMessage(), e);
            failureCounter.increment();
            result.addError(checkout.getId(), checkout.getTransactionId(), STAGE_SCAN,
                    "Unexpected error: " + e.getMessage());
        }
    }

    /**
     * Some orders take too long to authorize and fail locally while the gateway
     * settles them; this pass looks at recent settled PayPal checkouts to complete them.
     */
    private void completeFailedOrdersWithSettledCheckout(ReconciliationResult result) {
        LocalDateTime until = LocalDateTime.now();
        List<Checkout> candidates = checkoutRepository.findRecentWithPaypal(
                CheckoutState.SETTLED, until.minusHours(recoveryWindowHours), until);
        result.setRecoveryCandidates(candidates.size());

        for (Checkout checkout : candidates) {
            try {
                RecoveryOutcome outcome = failedOrderRecovery.recover(checkout);
                switch (outcome) {
                    case COMPLETED:
                        result.incrementRecoveredCompleted();
                        recoveredCompletedCounter.increment();
                        break;
                    case PENDING_AMOUNT_MISMATCH:
                        result.incrementRecoveredPending();
                        recoveredPendingCounter.increment();
                        break;
                    default:
                        break;
                }
            } catch (GatewayUnavailableException e) {
                log.warn("Gateway error while recovering checkout {}: {}", checkout.getId(), e.getMessage());
                gatewayErrorCounter.increment();
                result.addError(checkout.getId(), checkout.getTransactionId(), STAGE_RECOVERY, e.getMessage());
            } catch (Exception e) {
                log.error("Failed to recover order for checkout {}: {}", checkout.getId(), e.getMessage(), e);
                failureCounter.increment();
                result.addError(checkout.getId(), checkout.getTransactionId(), STAGE_RECOVERY,
                        "Unexpected error: " + e.getMessage());
            }
        }
    }

    /**
     * Current counts for monitoring dashboards.
     */
    public ReconciliationStats getStats() {
        return ReconciliationStats.builder()
                .openCheckoutCount(checkoutRepository.countByStateNotIn(CheckoutState.finalStates()))
                .settledCheckoutCount(checkoutRepository.countByState(CheckoutState.SETTLED))
                .failedPaymentCount(paymentRepository.countByState(PaymentState.FAILED))
                .completedPaymentCount(paymentRepository.countByState(PaymentState.COMPLETED))
                .isReconciliationRunning(isRunning.get())
                .build();
    }

    @lombok.Data
    @lombok.Builder
    public static class ReconciliationStats {
        private long openCheckoutCount;
        private long settledCheckoutCount;
        private long failedPaymentCount;
        private long completedPaymentCount;
        private boolean isReconciliationRunning;
    }
}

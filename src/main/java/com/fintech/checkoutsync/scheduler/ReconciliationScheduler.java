package com.fintech.checkoutsync.scheduler;

import com.fintech.checkoutsync.dto.ReconciliationResult;
import com.fintech.checkoutsync.exception.ReconciliationException;
import com.fintech.checkoutsync.service.ReconciliationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * Periodically triggers checkout reconciliation.
 * <p>
 * fixedDelay keeps runs from overlapping: the next one starts only after the
 * previous one returned. Default: every 5 minutes.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReconciliationScheduler {

    private final ReconciliationService reconciliationService;

    @Value("${reconciliation.scheduler.enabled:true}")
    private boolean schedulerEnabled;

    @Scheduled(fixedDelayString = "${reconciliation.scheduler.interval-ms:300000}")
    public void runScheduledReconciliation() {
        if (!schedulerEnabled) {
            log.debug("Scheduler is disabled, skipping reconciliation run");
            return;
        }

        log.info("Starting scheduled reconciliation at {}", LocalDateTime.now());

        try {
            ReconciliationResult result = reconciliationService.updateStates();

            logResult(result);

            if (result.getErrors() > result.getTotalProcessed() * 0.1) {
                log.warn("High error rate detected in reconciliation: {} errors out of {} processed",
                        result.getErrors(), result.getTotalProcessed());
            }

        } catch (ReconciliationException e) {
            log.warn("Reconciliation skipped: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Scheduled reconciliation failed with unexpected error", e);
        }
    }

    private void logResult(ReconciliationResult result) {
        if (result.getTotalProcessed() == 0 && result.getRecoveryCandidates() == 0) {
            log.info("No open checkouts or recovery candidates to reconcile");
        } else {
            log.info("Reconciliation completed in {}ms: {} changed, {} unchanged, {} recovered, {} errors",
                    result.getDurationMs(),
                    result.getChanged(),
                    result.getUnchanged(),
                    result.getRecoveredCompleted(),
                    result.getErrors());
        }
    }
}

package com.fintech.checkoutsync.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one update-states run: the checkout scan followed by failed order recovery.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationResult {

    private LocalDateTime startedAt;
    private LocalDateTime completedAt;

    @Builder.Default
    private int totalProcessed = 0;

    /**
     * Checkouts whose gateway status differed from the stored state.
     */
    @Builder.Default
    private int changed = 0;

    /**
     * Checkouts whose gateway status matched the stored state.
     */
    @Builder.Default
    private int unchanged = 0;

    @Builder.Default
    private int recoveryCandidates = 0;

    /**
     * Failed payments promoted all the way to completed.
     */
    @Builder.Default
    private int recoveredCompleted = 0;

    /**
     * Failed payments reopened as pending but left there because amounts disagreed.
     */
    @Builder.Default
    private int recoveredPending = 0;

    @Builder.Default
    private int errors = 0;

    @Builder.Default
    private List<ReconciliationError> errorDetails = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ReconciliationError {
        private Long checkoutId;
        private String transactionId;
        private String stage;
        private String errorMessage;
        private LocalDateTime occurredAt;
    }

    public void incrementChanged() {
        this.changed++;
    }

    public void incrementUnchanged() {
        this.unchanged++;
    }

    public void incrementRecoveredCompleted() {
        this.recoveredCompleted++;
    }

    public void incrementRecoveredPending() {
        this.recoveredPending++;
    }

    public void addError(Long checkoutId, String transactionId, String stage, String errorMessage) {
        this.errors++;
        if (this.errorDetails == null) {
            this.errorDetails = new ArrayList<>();
        }
        this.errorDetails.add(ReconciliationError.builder()
                .checkoutId(checkoutId)
                .transactionId(transactionId)
                .stage(stage)
                .errorMessage(errorMessage)
                .occurredAt(LocalDateTime.now())
                .build());
    }

    public long getDurationMs() {
        if (startedAt == null || completedAt == null) {
            return 0;
        }
        return java.time.Duration.between(startedAt, completedAt).toMillis();
    }
}

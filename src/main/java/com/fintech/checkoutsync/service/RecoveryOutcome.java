package com.fintech.checkoutsync.service;

/**
 * What failed order recovery did with one candidate checkout.
 */
public enum RecoveryOutcome {

    /**
     * Not a failed payment on a settled checkout; nothing done.
     */
    SKIPPED,

    /**
     * The gateway no longer reports the transaction as settled; payment left failed.
     */
    NOT_CONFIRMED,

    /**
     * Payment reopened as pending, but order total, payment amount and gateway
     * amount disagree so it was not completed.
     */
    PENDING_AMOUNT_MISMATCH,

    /**
     * Payment reopened and completed.
     */
    COMPLETED
}

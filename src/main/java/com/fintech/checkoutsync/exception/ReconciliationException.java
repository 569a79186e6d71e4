package com.fintech.checkoutsync.exception;

/**
 * Base exception for checkout reconciliation errors.
 */
public class ReconciliationException extends RuntimeException {

    public ReconciliationException(String message) {
        super(message);
    }
}

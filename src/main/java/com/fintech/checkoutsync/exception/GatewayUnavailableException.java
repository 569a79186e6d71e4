package com.fintech.checkoutsync.exception;

/**
 * Thrown when the payment gateway cannot be reached or answers with an error
 * while looking up a transaction.
 * <p>
 * Never aborts a reconciliation run: the affected checkout is left as it was
 * and picked up again by the next scan.
 */
public class GatewayUnavailableException extends ReconciliationException {

    private final String gatewayName;
    private final String transactionId;
    private final boolean retryable;

    public GatewayUnavailableException(String message, String gatewayName, String transactionId) {
        this(message, gatewayName, transactionId, true);
    }

    public GatewayUnavailableException(String message, String gatewayName, String transactionId,
                                       boolean retryable) {
        super(message);
        this.gatewayName = gatewayName;
        this.transactionId = transactionId;
        this.retryable = retryable;
    }

    public String getGatewayName() {
        return gatewayName;
    }

    public String getTransactionId() {
        return transactionId;
    }

    /**
     * False for lookups that will never succeed, such as an unknown transaction id.
     */
    public boolean isRetryable() {
        return retryable;
    }
}

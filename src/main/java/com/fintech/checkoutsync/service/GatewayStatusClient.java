package com.fintech.checkoutsync.service;

import com.fintech.checkoutsync.dto.GatewayTransaction;
import com.fintech.checkoutsync.exception.GatewayUnavailableException;

/**
 * Read-only view of the payment gateway's transactions.
 * <p>
 * Lookups never change anything on the gateway. A production implementation
 * wraps the gateway SDK's transaction lookup; the mock implementation keeps
 * transactions in memory.
 */
public interface GatewayStatusClient {

    /**
     * Fetches the current state of a gateway transaction.
     *
     * @param transactionId the gateway's transaction identifier
     * @return the transaction's current status and amount
     * @throws GatewayUnavailableException if the gateway cannot be reached or rejects the lookup
     */
    GatewayTransaction findTransaction(String transactionId) throws GatewayUnavailableException;

    /**
     * Name of the gateway, for logging and metrics.
     */
    String getGatewayName();

    boolean isAvailable();
}

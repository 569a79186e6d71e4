package com.fintech.checkoutsync.entity;

/**
 * Gateway-independent lifecycle state of an order payment.
 */
public enum PaymentState {
    /**
     * Payment attached to an order that is still in checkout.
     */
    CHECKOUT,

    PROCESSING,

    /**
     * Authorized but not yet captured or confirmed.
     */
    PENDING,

    COMPLETED,

    FAILED,

    VOID,

    INVALID
}

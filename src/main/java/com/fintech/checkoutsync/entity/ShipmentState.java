package com.fintech.checkoutsync.entity;

/**
 * Shipment readiness of an order, derived from its payments.
 */
public enum ShipmentState {
    /**
     * Waiting on payment.
     */
    PENDING,

    /**
     * Fully paid, can be shipped.
     */
    READY
}

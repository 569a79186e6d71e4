package com.fintech.checkoutsync.service;

import com.fintech.checkoutsync.entity.Order;

/**
 * Brings an order's shipments in line with its payments after a payment transition.
 * Failures propagate to the caller.
 */
public interface ShipmentSynchronizer {

    void resync(Order order);
}

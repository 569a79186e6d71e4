package com.fintech.checkoutsync.service;

import com.fintech.checkoutsync.entity.Order;
import com.fintech.checkoutsync.entity.Payment;
import com.fintech.checkoutsync.entity.PaymentState;
import com.fintech.checkoutsync.entity.ShipmentState;
import com.fintech.checkoutsync.repository.OrderRepository;
import com.fintech.checkoutsync.repository.PaymentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;

/**
 * Marks an order ready to ship once its completed payments cover the order
 * total, and back to pending otherwise.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OrderShipmentSynchronizer implements ShipmentSynchronizer {

    private final OrderRepository orderRepository;
    private final PaymentRepository paymentRepository;

    @Override
    @Transactional
    public void resync(Order order) {
        BigDecimal paid = paymentRepository.findByOrderId(order.getId()).stream()
                .filter(payment -> payment.getState() == PaymentState.COMPLETED)
                .map(Payment::getAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);

        ShipmentState target = paid.compareTo(order.getTotal()) >= 0 ? ShipmentState.READY : ShipmentState.PENDING;
        if (target == order.getShipmentState()) {
            log.debug("Order {} shipments already {}", order.getNumber(), target);
            return;
        }

        log.info("Order {} shipments {} -> {} (paid {} of {})",
                order.getNumber(), order.getShipmentState(), target, paid, order.getTotal());
        order.setShipmentState(target);
        orderRepository.save(order);
    }
}

package com.fintech.checkoutsync.service;

import com.fintech.checkoutsync.entity.Order;
import com.fintech.checkoutsync.entity.Payment;
import com.fintech.checkoutsync.entity.PaymentState;
import com.fintech.checkoutsync.entity.ShipmentState;
import com.fintech.checkoutsync.repository.OrderRepository;
import com.fintech.checkoutsync.repository.PaymentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OrderShipmentSynchronizerTest {

    @Mock
    private OrderRepository orderRepository;

    @Mock
    private PaymentRepository paymentRepository;

    private OrderShipmentSynchronizer synchronizer;

    private Order order;

    @BeforeEach
    void setUp() {
        synchronizer = new OrderShipmentSynchronizer(orderRepository, paymentRepository);
        order = Order.builder().id(3L).number("R300").total(new BigDecimal("100.00")).currency("USD").build();
    }

    @Test
    void shouldMarkReadyWhenCompletedPaymentsCoverTotal() {
        when(paymentRepository.findByOrderId(3L)).thenReturn(List.of(
                payment(PaymentState.COMPLETED, "60.00"),
                payment(PaymentState.COMPLETED, "40"),
                payment(PaymentState.FAILED, "100.00")));

        synchronizer.resync(order);

        assertThat(order.getShipmentState()).isEqualTo(ShipmentState.READY);
        verify(orderRepository).save(order);
    }

    @Test
    void shouldStayPendingWhenOnlyPendingPaymentsExist() {
        when(paymentRepository.findByOrderId(3L)).thenReturn(List.of(payment(PaymentState.PENDING, "100.00")));

        synchronizer.resync(order);

        assertThat(order.getShipmentState()).isEqualTo(ShipmentState.PENDING);
        verify(orderRepository, never()).save(any());
    }

    @Test
    void shouldMoveBackToPendingWhenCoverageIsLost() {
        order.setShipmentState(ShipmentState.READY);
        when(paymentRepository.findByOrderId(3L)).thenReturn(List.of(payment(PaymentState.COMPLETED, "50.00")));

        synchronizer.resync(order);

        assertThat(order.getShipmentState()).isEqualTo(ShipmentState.PENDING);
        verify(orderRepository).save(order);
    }

    private Payment payment(PaymentState state, String amount) {
        return Payment.builder().state(state).amount(new BigDecimal(amount)).order(order).build();
    }
}

package com.fintech.checkoutsync.repository;

import com.fintech.checkoutsync.entity.Payment;
import com.fintech.checkoutsync.entity.PaymentState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PaymentRepository extends JpaRepository<Payment, Long> {

    /**
     * The payment funded by the given checkout, if any.
     */
    Optional<Payment> findByCheckoutId(Long checkoutId);

    List<Payment> findByOrderId(Long orderId);

    long countByState(PaymentState state);
}

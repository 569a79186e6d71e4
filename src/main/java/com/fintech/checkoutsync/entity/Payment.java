package com.fintech.checkoutsync.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * An order payment funded by a gateway checkout.
 * <p>
 * State changes go through {@link #apply(PaymentAction)}, which refuses actions
 * the current state does not allow, or through the two recovery transitions
 * used when a locally failed payment turns out to be settled on the gateway.
 */
@Entity
@Table(name = "payments", indexes = {
        @Index(name = "idx_payment_checkout_id", columnList = "checkout_id", unique = true),
        @Index(name = "idx_payment_order_id", columnList = "order_id"),
        @Index(name = "idx_payment_state", columnList = "state")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Payment {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    @Setter(AccessLevel.NONE)
    private PaymentState state;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Column(name = "checkout_id")
    private Long checkoutId;

    @ManyToOne(fetch = FetchType.EAGER)
    @JoinColumn(name = "order_id", nullable = false)
    private Order order;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Version
    private Long version;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    /**
     * Fires a payment event.
     *
     * @return true if the payment moved, false if the action is not allowed from the current state
     */
    public boolean apply(PaymentAction action) {
        if (!action.canFireFrom(state)) {
            return false;
        }
        this.state = action.getTarget();
        return true;
    }

    /**
     * Reopens a failed payment whose checkout the gateway confirms as settled.
     */
    public void reopen() {
        if (state != PaymentState.FAILED) {
            throw new IllegalStateException(String.format(
                    "Payment %d can only be reopened from FAILED, was %s", id, state));
        }
        this.state = PaymentState.PENDING;
    }

    /**
     * Completes a reopened payment once all recorded amounts agree.
     */
    public void completeAfterRecovery() {
        if (state != PaymentState.PENDING) {
            throw new IllegalStateException(String.format(
                    "Payment %d can only be completed from PENDING, was %s", id, state));
        }
        this.state = PaymentState.COMPLETED;
    }

    public boolean isFailed() {
        return state == PaymentState.FAILED;
    }
}

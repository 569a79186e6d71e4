package com.fintech.checkoutsync.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * A gateway checkout: the funding source of an order payment.
 * <p>
 * The transaction_id is the gateway's identifier for the underlying transaction
 * and is what reconciliation queries the gateway with. The linked payment is the
 * one whose checkout_id points at this row.
 */
@Entity
@Table(name = "checkouts", indexes = {
        @Index(name = "idx_checkout_state", columnList = "state"),
        @Index(name = "idx_checkout_transaction_id", columnList = "transaction_id", unique = true),
        @Index(name = "idx_checkout_state_created_at", columnList = "state, created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Checkout {

    public static final String ACTION_VOID = "void";
    public static final String ACTION_SETTLE = "settle";
    public static final String ACTION_CREDIT = "credit";

    private static final Set<CheckoutState> VOIDABLE =
            EnumSet.of(CheckoutState.AUTHORIZED, CheckoutState.SUBMITTED_FOR_SETTLEMENT);
    private static final Set<CheckoutState> CREDITABLE =
            EnumSet.of(CheckoutState.SETTLED, CheckoutState.SETTLING);

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(length = 40)
    @Setter(AccessLevel.NONE)
    private CheckoutState state;

    @Column(name = "transaction_id", unique = true, length = 100)
    @Setter(AccessLevel.NONE)
    private String transactionId;

    @Column(name = "paypal_email")
    private String paypalEmail;

    @Column(name = "braintree_card_type", length = 40)
    private String braintreeCardType;

    @Column(name = "braintree_last_digits", length = 4)
    private String braintreeLastDigits;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Version
    private Long version;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    /**
     * Attaches the gateway transaction backing this checkout.
     *
     * @throws IllegalStateException if a different transaction id is already set
     */
    public void recordTransaction(String transactionId, CheckoutState initialState) {
        if (this.transactionId != null && !this.transactionId.equals(transactionId)) {
            throw new IllegalStateException(String.format(
                    "Checkout %d is already bound to transaction %s", id, this.transactionId));
        }
        this.transactionId = transactionId;
        if (this.state == null) {
            this.state = initialState;
        }
    }

    /**
     * Moves the checkout to the state observed on the gateway.
     *
     * @return the state held before the update
     * @throws IllegalStateException if the checkout already sits in a final state
     */
    public CheckoutState updateState(CheckoutState newState) {
        if (state != null && state.isFinal() && state != newState) {
            throw new IllegalStateException(String.format(
                    "Checkout %d is final in state %s and cannot move to %s", id, state, newState));
        }
        CheckoutState previous = this.state;
        this.state = newState;
        return previous;
    }

    public boolean isFinal() {
        return state != null && state.isFinal();
    }

    public boolean isPaypal() {
        return paypalEmail != null;
    }

    // Eligibility guards consulted before issuing operator actions against the gateway

    public List<String> actions() {
        return List.of(ACTION_VOID, ACTION_SETTLE, ACTION_CREDIT);
    }

    public boolean canVoid() {
        return state != null && VOIDABLE.contains(state);
    }

    public boolean canSettle() {
        return state == CheckoutState.AUTHORIZED;
    }

    public boolean canCredit() {
        return state != null && CREDITABLE.contains(state);
    }

    public List<String> eligibleActions() {
        List<String> eligible = new ArrayList<>();
        if (canVoid()) {
            eligible.add(ACTION_VOID);
        }
        if (canSettle()) {
            eligible.add(ACTION_SETTLE);
        }
        if (canCredit()) {
            eligible.add(ACTION_CREDIT);
        }
        return eligible;
    }
}

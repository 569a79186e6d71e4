package com.fintech.checkoutsync.entity;

import java.util.EnumSet;
import java.util.Set;

/**
 * An event applied to a {@link Payment} in response to an observed checkout state change.
 * <p>
 * Each action lists the payment states it may fire from and the state it leads to.
 */
public enum PaymentAction {

    PEND("pend", EnumSet.of(PaymentState.CHECKOUT, PaymentState.PROCESSING), PaymentState.PENDING),

    VOID("void", EnumSet.of(PaymentState.PENDING, PaymentState.PROCESSING,
            PaymentState.COMPLETED, PaymentState.CHECKOUT), PaymentState.VOID),

    COMPLETE("complete", EnumSet.of(PaymentState.PROCESSING, PaymentState.PENDING,
            PaymentState.CHECKOUT), PaymentState.COMPLETED),

    FAILURE("failure", EnumSet.of(PaymentState.PENDING, PaymentState.PROCESSING), PaymentState.FAILED);

    private final String code;
    private final Set<PaymentState> allowedFrom;
    private final PaymentState target;

    PaymentAction(String code, Set<PaymentState> allowedFrom, PaymentState target) {
        this.code = code;
        this.allowedFrom = allowedFrom;
        this.target = target;
    }

    public String getCode() {
        return code;
    }

    public PaymentState getTarget() {
        return target;
    }

    public boolean canFireFrom(PaymentState state) {
        return state != null && allowedFrom.contains(state);
    }
}

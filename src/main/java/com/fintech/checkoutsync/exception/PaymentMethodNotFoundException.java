package com.fintech.checkoutsync.exception;

public class PaymentMethodNotFoundException extends ReconciliationException {

    private final Long paymentMethodId;

    public PaymentMethodNotFoundException(Long paymentMethodId) {
        super("Payment method not found: " + paymentMethodId);
        this.paymentMethodId = paymentMethodId;
    }

    public Long getPaymentMethodId() {
        return paymentMethodId;
    }
}

package com.fintech.checkoutsync.service;

import com.fintech.checkoutsync.entity.CheckoutState;
import com.fintech.checkoutsync.entity.PaymentAction;
import com.fintech.checkoutsync.entity.PaymentState;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;
import java.util.Map;

/**
 * Translates gateway vocabulary into local vocabulary.
 * <p>
 * All mappings are total: input outside a table goes through an explicit
 * default branch, never an exception.
 */
@Slf4j
public final class StateMapper {

    private static final Map<String, String> CARD_TYPES = Map.of(
            "AmericanExpress", "american_express",
            "Diners Club", "diners_club",
            "MasterCard", "master"
    );

    private StateMapper() {
    }

    /**
     * Normalizes a gateway card brand label to the storefront's label.
     * Known labels are looked up case-sensitively, others are lower-cased,
     * a missing label becomes the empty string.
     */
    public static String mapCardType(String gatewayCardType) {
        if (gatewayCardType == null || gatewayCardType.isEmpty()) {
            return "";
        }
        String known = CARD_TYPES.get(gatewayCardType);
        if (known != null) {
            return known;
        }
        return gatewayCardType.toLowerCase(Locale.ROOT);
    }

    /**
     * Maps a payment status string to the action that brings a payment there.
     * Anything but pending, void and completed is treated as a failure to investigate.
     */
    public static PaymentAction mapStatusToAction(String status) {
        if (status == null) {
            return PaymentAction.FAILURE;
        }
        switch (status) {
            case "pending":
                return PaymentAction.PEND;
            case "void":
                return PaymentAction.VOID;
            case "completed":
                return PaymentAction.COMPLETE;
            default:
                return PaymentAction.FAILURE;
        }
    }

    /**
     * Typed variant of {@link #mapStatusToAction(String)}.
     */
    public static PaymentAction mapPaymentStateToAction(PaymentState paymentState) {
        if (paymentState == null) {
            return PaymentAction.FAILURE;
        }
        return switch (paymentState) {
            case PENDING -> PaymentAction.PEND;
            case VOID -> PaymentAction.VOID;
            case COMPLETED -> PaymentAction.COMPLETE;
            default -> PaymentAction.FAILURE;
        };
    }

    /**
     * The payment state a checkout state implies.
     */
    public static PaymentState mapCheckoutStateToPaymentState(CheckoutState checkoutState) {
        if (checkoutState == null) {
            return PaymentState.FAILED;
        }
        return switch (checkoutState) {
            case AUTHORIZING, AUTHORIZED, SETTLEMENT_PENDING -> PaymentState.PENDING;
            case VOIDED -> PaymentState.VOID;
            case SUBMITTED_FOR_SETTLEMENT, SETTLING, SETTLEMENT_CONFIRMED, SETTLED -> PaymentState.COMPLETED;
            default -> PaymentState.FAILED;
        };
    }

    /**
     * Checkout state to payment action, through the implied payment state.
     */
    public static PaymentAction mapCheckoutStateToAction(CheckoutState checkoutState) {
        return mapPaymentStateToAction(mapCheckoutStateToPaymentState(checkoutState));
    }

    /**
     * Parses a gateway status. Unknown codes map to {@link CheckoutState#UNRECOGNIZED}.
     */
    public static CheckoutState parseGatewayStatus(String gatewayStatus) {
        return CheckoutState.fromCode(gatewayStatus).orElseGet(() -> {
            log.warn("Unrecognized gateway status '{}'", gatewayStatus);
            return CheckoutState.UNRECOGNIZED;
        });
    }
}

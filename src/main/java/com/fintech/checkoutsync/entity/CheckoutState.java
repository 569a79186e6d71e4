package com.fintech.checkoutsync.entity;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Lifecycle state of a gateway checkout, mirrored from the gateway's transaction status.
 * <p>
 * Final states are terminal: once a checkout reaches one of them it is never
 * changed again and drops out of every reconciliation scan.
 */
public enum CheckoutState {

    AUTHORIZING("authorizing", false),
    AUTHORIZED("authorized", false),
    SUBMITTED_FOR_SETTLEMENT("submitted_for_settlement", false),
    SETTLING("settling", false),
    SETTLEMENT_PENDING("settlement_pending", false),
    SETTLEMENT_CONFIRMED("settlement_confirmed", false),

    /**
     * The gateway reported a status outside the known vocabulary.
     * Kept non-final so the checkout is looked at again on the next scan.
     */
    UNRECOGNIZED("unrecognized", false),

    AUTHORIZATION_EXPIRED("authorization_expired", true),
    PROCESSOR_DECLINED("processor_declined", true),
    GATEWAY_REJECTED("gateway_rejected", true),
    FAILED("failed", true),
    VOIDED("voided", true),
    SETTLED("settled", true),
    SETTLEMENT_DECLINED("settlement_declined", true),
    REFUNDED("refunded", true),
    RELEASED("released", true);

    private static final Set<CheckoutState> FINAL_STATES;

    static {
        EnumSet<CheckoutState> finals = EnumSet.noneOf(CheckoutState.class);
        for (CheckoutState state : values()) {
            if (state.terminal) {
                finals.add(state);
            }
        }
        FINAL_STATES = Collections.unmodifiableSet(finals);
    }

    private final String code;
    private final boolean terminal;

    CheckoutState(String code, boolean terminal) {
        this.code = code;
        this.terminal = terminal;
    }

    /**
     * The status string the gateway uses for this state.
     */
    public String getCode() {
        return code;
    }

    public boolean isFinal() {
        return terminal;
    }

    public static Set<CheckoutState> finalStates() {
        return FINAL_STATES;
    }

    /**
     * Looks up a state by its gateway code. Matching is exact; {@link #UNRECOGNIZED}
     * is never returned for an unknown code, callers decide how to treat those.
     */
    public static Optional<CheckoutState> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(state -> state != UNRECOGNIZED && state.code.equals(code))
                .findFirst();
    }
}

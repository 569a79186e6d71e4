package com.fintech.checkoutsync.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Card tokenization parameters posted by the storefront's drop-in form.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CheckoutParams {

    private String paypalEmail;

    /**
     * Card brand label as the gateway names it, e.g. "MasterCard".
     */
    private String braintreeCardType;

    private String braintreeLastTwo;
}

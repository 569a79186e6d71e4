package com.fintech.checkoutsync.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Optional;

/**
 * A payment method stored in the gateway vault. Every field may be absent:
 * PayPal accounts carry no card data and cards carry no email.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VaultedPaymentMethod {

    private String cardType;
    private String email;
    private String last4;

    public Optional<String> cardTypeIfPresent() {
        return Optional.ofNullable(cardType);
    }

    public Optional<String> emailIfPresent() {
        return Optional.ofNullable(email);
    }

    public Optional<String> last4IfPresent() {
        return Optional.ofNullable(last4);
    }
}

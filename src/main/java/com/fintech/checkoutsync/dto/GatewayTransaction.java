package com.fintech.checkoutsync.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * A transaction as the payment gateway currently reports it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GatewayTransaction {

    /**
     * The gateway's identifier for the transaction.
     */
    private String transactionId;

    /**
     * Raw gateway status, e.g. "authorized" or "settled".
     * Not guaranteed to belong to the known vocabulary.
     */
    private String status;

    /**
     * Amount as settled or authorized on the gateway. Compared against the order
     * total and the local payment amount before a recovered payment is completed.
     */
    private BigDecimal amount;

    /**
     * ISO 4217 currency code.
     */
    private String currencyIsoCode;

    private LocalDateTime updatedAt;
}

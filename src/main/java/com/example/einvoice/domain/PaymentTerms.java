package com.example.einvoice.domain;

import java.math.BigDecimal;

/**
 * Payment conditions printed on the invoice.
 *
 * French law requires the late-payment penalty rate and the fixed recovery
 * indemnity (40 EUR, art. D441-5 Code de commerce) to be stated.
 *
 * @param latePenaltyRate annual penalty rate in percent
 * @param earlyDiscount free text describing the early-payment discount, if any
 * @param recoveryFee fixed recovery indemnity, 40.00 when omitted
 */
public record PaymentTerms(
    String description,
    BigDecimal latePenaltyRate,
    String earlyDiscount,
    BigDecimal recoveryFee
) {

    public static final BigDecimal DEFAULT_RECOVERY_FEE = new BigDecimal("40.00");

    public PaymentTerms {
        if (latePenaltyRate != null && latePenaltyRate.signum() < 0) {
            throw new IllegalArgumentException("Late penalty rate cannot be negative");
        }
        if (recoveryFee == null) {
            recoveryFee = DEFAULT_RECOVERY_FEE;
        }
    }

    public PaymentTerms(String description) {
        this(description, null, null, DEFAULT_RECOVERY_FEE);
    }
}

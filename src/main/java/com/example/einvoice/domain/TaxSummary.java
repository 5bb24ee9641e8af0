package com.example.einvoice.domain;

import java.math.BigDecimal;

/**
 * VAT breakdown for one (category, rate) pair. Derived from the invoice lines,
 * never stored.
 */
public record TaxSummary(
    VatCategory category,
    BigDecimal rate,
    BigDecimal taxableAmount,
    BigDecimal taxAmount,
    String exemptionReason,
    String exemptionReasonCode
) {
}

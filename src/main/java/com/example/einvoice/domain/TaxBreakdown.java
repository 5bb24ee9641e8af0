package com.example.einvoice.domain;

import java.math.BigDecimal;

/**
 * VAT line of an aggregated e-reporting declaration. Either a rate or the
 * exemption flag identifies the line.
 */
public record TaxBreakdown(BigDecimal vatRate, boolean vatExemption, BigDecimal taxableAmount, BigDecimal vatAmount) {

    public TaxBreakdown {
        if (vatRate != null && vatRate.signum() < 0) {
            throw new IllegalArgumentException("VAT rate cannot be negative");
        }
        if (taxableAmount == null || vatAmount == null) {
            throw new IllegalArgumentException("Taxable amount and VAT amount are required");
        }
    }
}

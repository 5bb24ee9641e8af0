package com.example.einvoice.domain;

import java.math.BigDecimal;
import java.util.List;

/**
 * Document totals computed from the invoice lines.
 *
 * netTotal + taxTotal = grossTotal, and amountDue = grossTotal - prepaidAmount,
 * which may be negative.
 */
public record InvoiceTotals(
    BigDecimal netTotal,
    BigDecimal taxTotal,
    BigDecimal grossTotal,
    BigDecimal prepaidAmount,
    BigDecimal amountDue,
    List<TaxSummary> taxSummaries
) {

    public InvoiceTotals {
        taxSummaries = List.copyOf(taxSummaries);
    }

    /**
     * The rate carrying the largest taxable base, used where a single rate has to be reported.
     */
    public BigDecimal dominantRate() {
        TaxSummary dominant = null;
        for (TaxSummary summary : taxSummaries) {
            if (dominant == null || summary.taxableAmount().compareTo(dominant.taxableAmount()) > 0) {
                dominant = summary;
            }
        }
        return dominant != null ? dominant.rate() : null;
    }
}

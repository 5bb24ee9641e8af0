package com.example.einvoice.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Transactions summed over a period, per VAT breakdown.
 */
public record EReportingAggregate(
    String sellerSiren,
    LocalDate periodStart,
    LocalDate periodEnd,
    OperationCategory operationCategory,
    List<TaxBreakdown> taxBreakdowns,
    boolean vatOnDebits
) {

    public EReportingAggregate {
        if (operationCategory == null) {
            throw new IllegalArgumentException("Operation category is required");
        }
        if (taxBreakdowns == null || taxBreakdowns.isEmpty()) {
            throw new IllegalArgumentException("An aggregate needs at least one tax breakdown");
        }
        taxBreakdowns = List.copyOf(taxBreakdowns);
    }

    public BigDecimal totalExclTax() {
        return taxBreakdowns.stream().map(TaxBreakdown::taxableAmount).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal totalVat() {
        return taxBreakdowns.stream().map(TaxBreakdown::vatAmount).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal totalInclTax() {
        return totalExclTax().add(totalVat());
    }
}

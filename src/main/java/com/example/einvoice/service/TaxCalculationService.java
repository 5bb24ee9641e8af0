package com.example.einvoice.service;

import com.example.einvoice.domain.*;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Currency;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Computes invoice totals and VAT breakdowns from the invoice lines.
 *
 * Handles:
 * - Grouping lines by (VAT category, rate), ordered by category code then rate
 * - Rounding each group's taxable base once, never per line
 * - Half-up rounding to the currency's minor unit (2 decimals when unknown)
 * - Reverse charge groups, which always carry zero tax
 *
 * VAT Calculation:
 * - base = round(sum of exact line net amounts)
 * - tax = round(base * rate / 100)
 * - gross = net + tax, amount due = gross - prepaid (may be negative)
 *
 * Sub-lines are informative and excluded. Stateless and safe to share.
 */
@Service
public class TaxCalculationService {

    private static final int DEFAULT_SCALE = 2;
    private static final BigDecimal HUNDRED = new BigDecimal("100");

    private static final Comparator<GroupKey> GROUP_ORDER =
        Comparator.comparing((GroupKey key) -> key.category().getCode())
                  .thenComparing(GroupKey::rate);

    /**
     * Computes the full set of totals for an invoice.
     *
     * @param invoice The invoice to compute
     * @return Net, tax, gross, prepaid and due amounts with one summary per VAT group
     */
    public InvoiceTotals compute(Invoice invoice) {
        int scale = minorUnits(invoice.getCurrency());

        Map<GroupKey, Group> groups = new TreeMap<>(GROUP_ORDER);
        for (InvoiceLine line : invoice.getLines()) {
            GroupKey key = new GroupKey(line.getVatCategory(), line.getVatRate().stripTrailingZeros());
            groups.computeIfAbsent(key, k -> new Group(line.getVatRate())).add(line);
        }

        List<TaxSummary> summaries = new ArrayList<>();
        BigDecimal netTotal = BigDecimal.ZERO.setScale(scale);
        BigDecimal taxTotal = BigDecimal.ZERO.setScale(scale);

        for (Map.Entry<GroupKey, Group> entry : groups.entrySet()) {
            VatCategory category = entry.getKey().category();
            Group group = entry.getValue();

            BigDecimal base = group.exactBase.setScale(scale, RoundingMode.HALF_UP);
            BigDecimal tax = calculateTax(base, group.rate, category, scale);

            summaries.add(new TaxSummary(category, group.rate, base, tax,
                group.exemptionReason, group.exemptionReasonCode));
            netTotal = netTotal.add(base);
            taxTotal = taxTotal.add(tax);
        }

        BigDecimal grossTotal = netTotal.add(taxTotal);
        BigDecimal prepaid = invoice.getPrepaidAmount() != null
            ? invoice.getPrepaidAmount().setScale(scale, RoundingMode.HALF_UP)
            : BigDecimal.ZERO.setScale(scale);
        BigDecimal amountDue = grossTotal.subtract(prepaid);

        return new InvoiceTotals(netTotal, taxTotal, grossTotal, prepaid, amountDue, summaries);
    }

    /**
     * Calculates the VAT on an already rounded taxable base.
     *
     * @param base The taxable base
     * @param rate The rate in percent (e.g. 20.0)
     * @param category The VAT category; reverse charge yields zero
     * @param scale Number of decimals of the currency
     * @return Tax rounded half-up to the given scale
     */
    public BigDecimal calculateTax(BigDecimal base, BigDecimal rate, VatCategory category, int scale) {
        if (category.isReverseCharge() || rate.signum() == 0) {
            return BigDecimal.ZERO.setScale(scale);
        }
        return base.multiply(rate)
                   .divide(HUNDRED)
                   .setScale(scale, RoundingMode.HALF_UP);
    }

    /**
     * Rounds an amount to the minor unit of the given currency.
     */
    public BigDecimal round(BigDecimal amount, String currencyCode) {
        return amount.setScale(minorUnits(currencyCode), RoundingMode.HALF_UP);
    }

    /**
     * Number of decimals of an ISO 4217 currency, 2 for unknown or fund codes.
     */
    static int minorUnits(String currencyCode) {
        try {
            int digits = Currency.getInstance(currencyCode).getDefaultFractionDigits();
            return digits >= 0 ? digits : DEFAULT_SCALE;
        } catch (IllegalArgumentException e) {
            return DEFAULT_SCALE;
        }
    }

    private record GroupKey(VatCategory category, BigDecimal rate) {
    }

    private static final class Group {
        private final BigDecimal rate;
        private BigDecimal exactBase = BigDecimal.ZERO;
        private String exemptionReason;
        private String exemptionReasonCode;

        private Group(BigDecimal rate) {
            this.rate = rate;
        }

        private void add(InvoiceLine line) {
            exactBase = exactBase.add(line.getNetAmount());
            if (exemptionReason == null) {
                exemptionReason = line.getExemptionReason();
            }
            if (exemptionReasonCode == null) {
                exemptionReasonCode = line.getExemptionReasonCode();
            }
        }
    }
}

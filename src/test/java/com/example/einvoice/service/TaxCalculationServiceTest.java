package com.example.einvoice.service;

import com.example.einvoice.TestInvoices;
import com.example.einvoice.domain.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static com.example.einvoice.TestInvoices.amount;
import static com.example.einvoice.TestInvoices.line;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for TaxCalculationService.
 * Tests invoice totals including:
 * - Grouping of lines by (category, rate)
 * - Rounding once per group, half-up to the currency's minor unit
 * - Reverse charge and exemptions
 * - Prepaid amounts and negative amounts due
 */
class TaxCalculationServiceTest {

    private TaxCalculationService taxCalculationService;

    @BeforeEach
    void setUp() {
        taxCalculationService = new TaxCalculationService();
    }

    // ==================== Grouping Tests ====================

    @Test
    void compute_twoRates_producesOneSummaryPerRate() {
        InvoiceTotals totals = taxCalculationService.compute(TestInvoices.standard());

        assertEquals(2, totals.taxSummaries().size());
        TaxSummary reduced = totals.taxSummaries().get(0);
        TaxSummary standard = totals.taxSummaries().get(1);

        assertEquals(0, reduced.rate().compareTo(amount("5.5")));
        assertEquals(amount("200.00"), reduced.taxableAmount());
        assertEquals(amount("11.00"), reduced.taxAmount());
        assertEquals(0, standard.rate().compareTo(amount("20.0")));
        assertEquals(amount("150.00"), standard.taxableAmount());
        assertEquals(amount("30.00"), standard.taxAmount());

        assertEquals(amount("350.00"), totals.netTotal());
        assertEquals(amount("41.00"), totals.taxTotal());
        assertEquals(amount("391.00"), totals.grossTotal());
    }

    @Test
    void compute_sameRateDifferentScale_groupsTogether() {
        Invoice invoice = TestInvoices.standardBuilder()
            .lines(List.of(
                line("A", "1", "10.00", "20"),
                line("B", "1", "15.00", "20.00")))
            .build();

        InvoiceTotals totals = taxCalculationService.compute(invoice);

        assertEquals(1, totals.taxSummaries().size());
        assertEquals(amount("25.00"), totals.netTotal());
        assertEquals(amount("5.00"), totals.taxTotal());
    }

    @Test
    void compute_roundsOncePerGroup() {
        // 3 x 0.333 = 0.999 summed exactly, rounded once to 1.00
        Invoice invoice = TestInvoices.standardBuilder()
            .lines(List.of(
                line("A", "1", "0.333", "20.0"),
                line("B", "1", "0.333", "20.0"),
                line("C", "1", "0.333", "20.0")))
            .build();

        InvoiceTotals totals = taxCalculationService.compute(invoice);

        assertEquals(amount("1.00"), totals.netTotal());
        assertEquals(amount("0.20"), totals.taxTotal());
    }

    @Test
    void compute_taxRoundsHalfUp() {
        // 20% of 0.025 base rounded to 0.03 -> 0.006 -> 0.01
        Invoice invoice = TestInvoices.standardBuilder()
            .lines(List.of(line("A", "1", "0.025", "20.0")))
            .build();

        InvoiceTotals totals = taxCalculationService.compute(invoice);

        assertEquals(amount("0.03"), totals.netTotal());
        assertEquals(amount("0.01"), totals.taxTotal());
    }

    @Test
    void compute_discountAndCharge_adjustLineNet() {
        InvoiceLine discounted = InvoiceLine.builder()
            .description("Monture")
            .quantity("2")
            .unitPrice("50.00")
            .discountAmount(amount("10.00"))
            .chargeAmount(amount("5.00"))
            .build();
        Invoice invoice = TestInvoices.standardBuilder().lines(List.of(discounted)).build();

        InvoiceTotals totals = taxCalculationService.compute(invoice);

        assertEquals(amount("95.00"), totals.netTotal());
        assertEquals(amount("19.00"), totals.taxTotal());
    }

    // ==================== Category Tests ====================

    @Test
    void compute_reverseCharge_contributesNoTax() {
        InvoiceLine reverse = InvoiceLine.builder()
            .description("Prestation BTP")
            .quantity("1")
            .unitPrice("1000.00")
            .vatRate("0")
            .vatCategory(VatCategory.REVERSE_CHARGE)
            .exemption("Autoliquidation", "VATEX-FR-AE")
            .build();
        Invoice invoice = TestInvoices.standardBuilder()
            .lines(List.of(reverse, line("Fournitures", "1", "100.00", "20.0")))
            .build();

        InvoiceTotals totals = taxCalculationService.compute(invoice);

        TaxSummary reverseSummary = totals.taxSummaries().stream()
            .filter(s -> s.category() == VatCategory.REVERSE_CHARGE)
            .findFirst()
            .orElseThrow();
        assertEquals(amount("0.00"), reverseSummary.taxAmount());
        assertEquals("VATEX-FR-AE", reverseSummary.exemptionReasonCode());
        assertEquals(amount("20.00"), totals.taxTotal());
        assertEquals(amount("1100.00"), totals.netTotal());
    }

    @Test
    void compute_sameRateDifferentCategory_keepsSeparateSummaries() {
        InvoiceLine exempt = InvoiceLine.builder()
            .description("Formation")
            .quantity("1")
            .unitPrice("300.00")
            .vatRate("0")
            .vatCategory(VatCategory.EXEMPT)
            .exemption("Exonération article 261-4-4°", "VATEX-FR-261-4-4")
            .build();
        InvoiceLine zero = InvoiceLine.builder()
            .description("Livre")
            .quantity("1")
            .unitPrice("20.00")
            .vatRate("0")
            .vatCategory(VatCategory.ZERO_RATED)
            .build();
        Invoice invoice = TestInvoices.standardBuilder().lines(List.of(exempt, zero)).build();

        InvoiceTotals totals = taxCalculationService.compute(invoice);

        assertEquals(2, totals.taxSummaries().size());
        assertEquals(amount("0.00"), totals.taxTotal());
    }

    // ==================== Prepaid Tests ====================

    @Test
    void compute_afterPrepaymentInvoice_deductsPrepaidAmount() {
        Invoice prepayment = TestInvoices.standardBuilder()
            .number("FA-2026-ACOMPTE")
            .typeCode(InvoiceTypeCode.PREPAYMENT_INVOICE)
            .lines(List.of(line("Acompte 30 %", "1", "1000.00", "0")))
            .build();
        BigDecimal prepaid = taxCalculationService.compute(prepayment).grossTotal();
        assertEquals(amount("1000.00"), prepaid);

        Invoice finalInvoice = TestInvoices.standardBuilder()
            .number("FA-2026-SOLDE")
            .prepaidAmount(prepaid)
            .build();

        InvoiceTotals totals = taxCalculationService.compute(finalInvoice);

        assertEquals(totals.grossTotal().subtract(amount("1000.00")), totals.amountDue());
        assertEquals(amount("-609.00"), totals.amountDue());
    }

    @Test
    void compute_noPrepaid_amountDueEqualsGross() {
        InvoiceTotals totals = taxCalculationService.compute(TestInvoices.standard());

        assertEquals(amount("0.00"), totals.prepaidAmount());
        assertEquals(totals.grossTotal(), totals.amountDue());
    }

    // ==================== Consistency Tests ====================

    @Test
    void compute_summariesAlwaysAddUpToTotals() {
        Invoice invoice = TestInvoices.standardBuilder()
            .lines(List.of(
                line("A", "3", "19.99", "20.0"),
                line("B", "7", "4.15", "5.5"),
                line("C", "1.5", "33.33", "10.0"),
                line("D", "2", "0.99", "2.1"),
                line("E", "11", "1.07", "20.0")))
            .build();

        InvoiceTotals totals = taxCalculationService.compute(invoice);

        BigDecimal bases = totals.taxSummaries().stream()
            .map(TaxSummary::taxableAmount).reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal taxes = totals.taxSummaries().stream()
            .map(TaxSummary::taxAmount).reduce(BigDecimal.ZERO, BigDecimal::add);

        assertEquals(0, bases.compareTo(totals.netTotal()));
        assertEquals(0, taxes.compareTo(totals.taxTotal()));
        assertEquals(0, totals.netTotal().add(totals.taxTotal()).compareTo(totals.grossTotal()));
        assertEquals(4, totals.taxSummaries().size());
    }

    // ==================== Currency Tests ====================

    @Test
    void minorUnits_knownCurrencies() {
        assertEquals(2, TaxCalculationService.minorUnits("EUR"));
        assertEquals(0, TaxCalculationService.minorUnits("JPY"));
        assertEquals(3, TaxCalculationService.minorUnits("KWD"));
    }

    @Test
    void minorUnits_unknownCurrency_defaultsToTwo() {
        assertEquals(2, TaxCalculationService.minorUnits("XYZ"));
    }

    @Test
    void round_usesCurrencyScale() {
        assertEquals(amount("1235"), taxCalculationService.round(amount("1234.5"), "JPY"));
        assertEquals(amount("12.35"), taxCalculationService.round(amount("12.345"), "EUR"));
    }
}

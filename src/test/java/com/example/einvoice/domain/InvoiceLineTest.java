package com.example.einvoice.domain;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class InvoiceLineTest {

    @Test
    void build_defaults_standardRateAndPiece() {
        InvoiceLine line = InvoiceLine.builder()
            .description("Monture")
            .quantity("2")
            .unitPrice("45.50")
            .build();

        assertEquals(VatCategory.STANDARD, line.getVatCategory());
        assertEquals(UnitOfMeasure.PIECE, line.getUnit());
        assertEquals(0, line.getVatRate().compareTo(new BigDecimal("20")));
        assertEquals(new BigDecimal("91.00"), line.getNetAmount());
    }

    @Test
    void build_reverseChargeWithNonZeroRate_throws() {
        InvoiceLine.Builder builder = InvoiceLine.builder()
            .description("Sous-traitance")
            .quantity("1")
            .unitPrice("500.00")
            .vatRate("20.0")
            .vatCategory(VatCategory.REVERSE_CHARGE);

        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void build_reverseChargeWithoutReasonCode_throws() {
        InvoiceLine.Builder builder = InvoiceLine.builder()
            .description("Sous-traitance")
            .quantity("1")
            .unitPrice("500.00")
            .vatRate("0")
            .vatCategory(VatCategory.REVERSE_CHARGE);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, builder::build);
        assertTrue(e.getMessage().contains("exemption reason code"));
    }

    @Test
    void build_reverseChargeWithReasonCode_succeeds() {
        InvoiceLine line = InvoiceLine.builder()
            .description("Sous-traitance")
            .quantity("1")
            .unitPrice("500.00")
            .vatRate("0")
            .vatCategory(VatCategory.REVERSE_CHARGE)
            .exemption("Autoliquidation", "VATEX-FR-AE")
            .build();

        assertEquals("VATEX-FR-AE", line.getExemptionReasonCode());
    }

    @Test
    void build_negativeDiscount_throws() {
        InvoiceLine.Builder builder = InvoiceLine.builder()
            .description("Monture")
            .quantity("1")
            .unitPrice("10.00")
            .discountAmount(new BigDecimal("-1"));

        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void build_zeroLineNumber_throws() {
        InvoiceLine.Builder builder = InvoiceLine.builder()
            .lineNumber(0)
            .description("Monture")
            .quantity("1")
            .unitPrice("10.00");

        assertThrows(IllegalArgumentException.class, builder::build);
    }

    @Test
    void build_periodEndingBeforeStart_throws() {
        InvoiceLine.Builder builder = InvoiceLine.builder()
            .description("Abonnement")
            .quantity("1")
            .unitPrice("10.00")
            .billingPeriod(LocalDate.of(2026, 9, 30), LocalDate.of(2026, 9, 1));

        assertThrows(IllegalArgumentException.class, builder::build);
    }
}

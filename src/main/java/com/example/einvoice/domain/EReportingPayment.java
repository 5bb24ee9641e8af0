package com.example.einvoice.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A cash receipt for services taxed on receipts (VAT due when paid).
 */
public record EReportingPayment(
    String paymentId,
    String sellerSiren,
    LocalDate cashingDate,
    BigDecimal cashedAmount,
    String currency,
    String invoiceReference
) {

    public EReportingPayment {
        if (paymentId == null) {
            paymentId = UUID.randomUUID().toString();
        }
        if (currency == null) {
            currency = Invoice.DEFAULT_CURRENCY;
        }
    }

    public EReportingPayment(String sellerSiren, LocalDate cashingDate, BigDecimal cashedAmount, String invoiceReference) {
        this(null, sellerSiren, cashingDate, cashedAmount, Invoice.DEFAULT_CURRENCY, invoiceReference);
    }
}

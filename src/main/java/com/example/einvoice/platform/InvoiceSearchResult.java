package com.example.einvoice.platform;

import com.example.einvoice.domain.InvoiceStatus;

import java.math.BigDecimal;
import java.time.LocalDate;

public record InvoiceSearchResult(
    String invoiceId,
    String number,
    LocalDate issueDate,
    String sellerName,
    String buyerName,
    BigDecimal totalInclTax,
    String currency,
    InvoiceStatus status,
    Direction direction
) {
}

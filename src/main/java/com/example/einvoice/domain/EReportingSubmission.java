package com.example.einvoice.domain;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * An e-reporting batch ready to be handed to the filing platform.
 *
 * Carries exactly one kind of content: individual transactions, an aggregate,
 * or a payment. It keeps no reference to the invoices it was derived from.
 */
public record EReportingSubmission(
    String submissionId,
    EReportingTransmissionMode transmissionMode,
    String sellerSiren,
    VatRegime vatRegime,
    LocalDate periodStart,
    LocalDate periodEnd,
    List<EReportingTransaction> transactions,
    EReportingAggregate aggregatedData,
    EReportingPayment paymentData,
    Instant createdAt
) {

    public EReportingSubmission {
        transactions = transactions != null ? List.copyOf(transactions) : List.of();
    }

    public boolean isPaymentSubmission() {
        return paymentData != null;
    }
}

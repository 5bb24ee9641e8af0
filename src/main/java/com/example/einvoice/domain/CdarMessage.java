package com.example.einvoice.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Lifecycle status message (UN/CEFACT CDAR D22B) exchanged between the
 * platforms, the parties and the tax administration.
 *
 * @param amount cashed amount for partial collections
 */
public record CdarMessage(
    String messageId,
    LocalDate issueDate,
    InvoiceStatus status,
    String invoiceReference,
    CdarParty sender,
    List<CdarParty> recipients,
    String reason,
    String reasonCode,
    BigDecimal amount
) {

    public CdarMessage {
        if (messageId == null || messageId.isBlank()) {
            throw new IllegalArgumentException("Message ID is required");
        }
        if (issueDate == null || status == null || sender == null) {
            throw new IllegalArgumentException("Issue date, status and sender are required");
        }
        if (invoiceReference == null || invoiceReference.isBlank()) {
            throw new IllegalArgumentException("Invoice reference is required");
        }
        if (status.isReasonRequired() && (reason == null || reason.isBlank())) {
            throw new IllegalArgumentException("A reason is required for status " + status);
        }
        recipients = recipients != null ? List.copyOf(recipients) : List.of();
    }
}

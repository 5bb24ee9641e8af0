package com.example.einvoice.platform;

import com.example.einvoice.domain.InvoiceStatus;

import java.time.Instant;

/**
 * Platform acknowledgement of a deposited invoice.
 */
public record SubmissionResponse(String invoiceId, InvoiceStatus status, Instant submittedAt) {
}

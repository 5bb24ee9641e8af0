package com.example.einvoice.platform;

import com.example.einvoice.domain.InvoiceStatus;

import java.time.Instant;

public record StatusUpdateResponse(String invoiceId, InvoiceStatus status, Instant updatedAt) {
}

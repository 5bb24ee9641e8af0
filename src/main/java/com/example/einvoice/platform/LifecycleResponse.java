package com.example.einvoice.platform;

import com.example.einvoice.domain.InvoiceStatus;
import com.example.einvoice.domain.LifecycleEvent;

import java.util.List;

/**
 * Ordered lifecycle events of an invoice, oldest first.
 */
public record LifecycleResponse(String invoiceId, InvoiceStatus currentStatus, List<LifecycleEvent> events) {

    public LifecycleResponse {
        events = List.copyOf(events);
    }
}

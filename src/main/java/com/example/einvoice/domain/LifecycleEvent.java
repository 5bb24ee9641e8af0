package com.example.einvoice.domain;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * One entry of an invoice's lifecycle history.
 *
 * @param amount cashed amount, only meaningful for partial collections
 */
public record LifecycleEvent(
    InvoiceStatus status,
    Instant timestamp,
    String reason,
    String reasonCode,
    PartyRole producer,
    BigDecimal amount
) {

    public static LifecycleEvent of(InvoiceStatus status, Instant timestamp) {
        return new LifecycleEvent(status, timestamp, null, null, status.getDefaultProducer(), null);
    }
}

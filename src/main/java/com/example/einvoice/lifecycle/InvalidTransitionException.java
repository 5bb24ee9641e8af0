package com.example.einvoice.lifecycle;

import com.example.einvoice.domain.InvoiceStatus;

/**
 * Thrown when a lifecycle change is rejected. The manager's state is left untouched.
 */
public class InvalidTransitionException extends IllegalStateException {

    private final InvoiceStatus from;
    private final InvoiceStatus to;

    public InvalidTransitionException(InvoiceStatus from, InvoiceStatus to, String message) {
        super(message);
        this.from = from;
        this.to = to;
    }

    public InvoiceStatus getFrom() {
        return from;
    }

    public InvoiceStatus getTo() {
        return to;
    }
}

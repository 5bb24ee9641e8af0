package com.example.einvoice.service;

/**
 * Thrown when an invoice cannot be encoded because a field required by the
 * selected format, profile or invoice type is missing. No bytes are produced.
 */
public class InvoiceEncodingException extends RuntimeException {

    public InvoiceEncodingException(String message) {
        super(message);
    }
}

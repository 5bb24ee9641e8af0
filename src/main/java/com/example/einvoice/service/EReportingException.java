package com.example.einvoice.service;

/**
 * Base class of e-reporting failures.
 */
public class EReportingException extends RuntimeException {

    public EReportingException(String message) {
        super(message);
    }

    public EReportingException(String message, Throwable cause) {
        super(message, cause);
    }
}

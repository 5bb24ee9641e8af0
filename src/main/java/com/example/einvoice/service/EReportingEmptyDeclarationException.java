package com.example.einvoice.service;

/**
 * Thrown for a declaration without any operation. Blank declarations are not
 * transmitted: no operations means no submission.
 */
public class EReportingEmptyDeclarationException extends EReportingException {

    public EReportingEmptyDeclarationException(String message) {
        super(message);
    }
}

package com.example.einvoice.domain;

/**
 * XML syntaxes produced and validated by the engine.
 */
public enum InvoiceFormat {
    CII,    // UN/CEFACT Cross Industry Invoice D16B (Factur-X)
    UBL     // OASIS UBL 2.1
}

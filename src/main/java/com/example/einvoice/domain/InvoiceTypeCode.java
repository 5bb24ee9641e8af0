package com.example.einvoice.domain;

/**
 * Invoice type codes (UNTDID 1001) accepted by the French e-invoicing reform.
 */
public enum InvoiceTypeCode {
    INVOICE("380"),
    CREDIT_NOTE("381"),
    DEBIT_NOTE("383"),
    CORRECTED_INVOICE("384"),
    PREPAYMENT_INVOICE("386"),
    SELF_BILLED_INVOICE("389");

    private final String code;

    InvoiceTypeCode(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Credit notes and corrected invoices must point to the invoice they amend.
     */
    public boolean requiresPrecedingReference() {
        return this == CREDIT_NOTE || this == CORRECTED_INVOICE;
    }

    /**
     * Types serialised with a credit-note root in UBL.
     */
    public boolean isCreditNote() {
        return this == CREDIT_NOTE || this == CORRECTED_INVOICE;
    }

    public static InvoiceTypeCode fromCode(String code) {
        for (InvoiceTypeCode type : values()) {
            if (type.code.equals(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown invoice type code: " + code);
    }
}

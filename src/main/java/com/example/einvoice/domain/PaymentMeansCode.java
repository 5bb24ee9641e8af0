package com.example.einvoice.domain;

/**
 * Payment means codes (UNTDID 4461).
 */
public enum PaymentMeansCode {
    CASH("10"),
    CHEQUE("20"),
    CREDIT_TRANSFER("30"),
    PAYMENT_TO_BANK_ACCOUNT("42"),
    BANK_CARD("48"),
    DIRECT_DEBIT("49"),
    SEPA_CREDIT_TRANSFER("58"),
    SEPA_DIRECT_DEBIT("59");

    private final String code;

    PaymentMeansCode(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}

package com.example.einvoice.domain;

public record BankAccount(String iban, String bic) {

    public BankAccount {
        if (iban == null || iban.isBlank()) {
            throw new IllegalArgumentException("IBAN is required");
        }
        iban = iban.replace(" ", "").toUpperCase();
    }
}

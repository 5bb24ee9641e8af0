package com.example.einvoice.domain;

public record PaymentMeans(PaymentMeansCode code, BankAccount bankAccount, String paymentReference) {

    public PaymentMeans {
        if (code == null) {
            throw new IllegalArgumentException("Payment means code is required");
        }
    }

    public PaymentMeans(PaymentMeansCode code) {
        this(code, null, null);
    }
}

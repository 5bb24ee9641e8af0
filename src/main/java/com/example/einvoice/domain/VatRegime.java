package com.example.einvoice.domain;

/**
 * Seller VAT regime, which drives the e-reporting transmission calendar.
 */
public enum VatRegime {
    REAL_NORMAL_MONTHLY,
    REAL_NORMAL_QUARTERLY,
    SIMPLIFIED_REAL,
    FRANCHISE           // Franchise en base de TVA
}

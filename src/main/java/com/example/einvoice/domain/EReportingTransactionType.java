package com.example.einvoice.domain;

/**
 * Transactions outside the domestic B2B e-invoicing scope that must be e-reported.
 */
public enum EReportingTransactionType {
    B2C_DOMESTIC,
    B2B_INTRA_EU,
    B2B_EXTRA_EU;

    public boolean isInternational() {
        return this != B2C_DOMESTIC;
    }
}

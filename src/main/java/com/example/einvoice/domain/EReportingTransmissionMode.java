package com.example.einvoice.domain;

public enum EReportingTransmissionMode {
    INDIVIDUAL,     // Transaction by transaction
    AGGREGATED      // Daily totals per SIREN
}

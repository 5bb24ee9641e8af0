package com.example.einvoice.domain;

/**
 * Whether a lifecycle status must be reported to the tax administration.
 */
public enum StatusCategory {
    MANDATORY,      // Transmitted to the PPF / DGFiP
    RECOMMENDED     // Exchanged between the parties only
}

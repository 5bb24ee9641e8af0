package com.example.einvoice.platform;

import java.time.LocalDate;

/**
 * Central directory entry: the platform on which a company receives its invoices.
 */
public record DirectoryEntry(
    String siren,
    String companyName,
    String platformId,
    String platformName,
    String electronicAddress,
    LocalDate registrationDate
) {

    public DirectoryEntry {
        if (siren == null || siren.isBlank()) {
            throw new IllegalArgumentException("SIREN is required");
        }
    }
}

package com.example.einvoice.service;

import com.example.einvoice.domain.FacturXProfile;
import com.example.einvoice.domain.InvoiceFormat;

/**
 * Output of a generator.
 *
 * @param pdf hybrid PDF, only set by the Factur-X generator
 */
public record GenerationResult(InvoiceFormat format, FacturXProfile profile, byte[] xml, byte[] pdf) {

    public static GenerationResult xmlOnly(InvoiceFormat format, FacturXProfile profile, byte[] xml) {
        return new GenerationResult(format, profile, xml, null);
    }

    public boolean hasPdf() {
        return pdf != null;
    }
}

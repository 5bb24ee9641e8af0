package com.example.einvoice.service;

import com.example.einvoice.domain.FacturXProfile;
import com.example.einvoice.domain.Invoice;
import com.example.einvoice.domain.InvoiceFormat;

/**
 * Serialises an invoice into one XML syntax.
 */
public interface InvoiceGenerator {

    InvoiceFormat getFormat();

    /**
     * @throws InvoiceEncodingException when a field required by the profile or invoice type is missing
     */
    byte[] generateXml(Invoice invoice, FacturXProfile profile);

    default GenerationResult generate(Invoice invoice, FacturXProfile profile) {
        return GenerationResult.xmlOnly(getFormat(), profile, generateXml(invoice, profile));
    }
}

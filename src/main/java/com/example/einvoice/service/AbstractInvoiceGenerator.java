package com.example.einvoice.service;

import com.example.einvoice.domain.FacturXProfile;
import com.example.einvoice.domain.Invoice;
import com.example.einvoice.domain.InvoiceTotals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks shared by every XML generator before a single element is written.
 */
public abstract class AbstractInvoiceGenerator implements InvoiceGenerator {

    private static final Logger log = LoggerFactory.getLogger(AbstractInvoiceGenerator.class);

    protected final TaxCalculationService taxCalculationService;
    protected final FacturXProfile defaultProfile;

    protected AbstractInvoiceGenerator(TaxCalculationService taxCalculationService, String defaultProfile) {
        this.taxCalculationService = taxCalculationService;
        this.defaultProfile = FacturXProfile.fromName(defaultProfile);
    }

    public FacturXProfile getDefaultProfile() {
        return defaultProfile;
    }

    /**
     * Generates the XML with the configured default profile.
     */
    public byte[] generateXml(Invoice invoice) {
        return generateXml(invoice, defaultProfile);
    }

    /**
     * Verifies the invoice can be encoded with the profile and computes its totals.
     *
     * @return The totals every section of the document is written from
     * @throws InvoiceEncodingException if a required field is missing
     */
    protected InvoiceTotals prepare(Invoice invoice, FacturXProfile profile) {
        if (profile == null) {
            throw new InvoiceEncodingException("Unknown profile for " + getFormat() + ": null");
        }
        if (invoice.getTypeCode().requiresPrecedingReference()
                && (invoice.getPrecedingInvoiceReference() == null || invoice.getPrecedingInvoiceReference().isBlank())) {
            throw new InvoiceEncodingException("Invoice " + invoice.getNumber() + " of type "
                + invoice.getTypeCode().getCode() + " requires a preceding invoice reference");
        }

        InvoiceTotals totals = taxCalculationService.compute(invoice);

        if (profile.isRegulatoryCompliant()
                && totals.amountDue().signum() > 0
                && invoice.getDueDate() == null
                && invoice.getPaymentTerms() == null) {
            throw new InvoiceEncodingException("[BR-CO-25] Invoice " + invoice.getNumber()
                + " has a positive amount due and needs a due date or payment terms");
        }

        if (!profile.isRegulatoryCompliant()) {
            log.warn("Invoice {} encoded with profile {} which is below the EN16931 floor required by the French reform",
                invoice.getNumber(), profile);
        }
        return totals;
    }

    protected int scale(Invoice invoice) {
        return TaxCalculationService.minorUnits(invoice.getCurrency());
    }

    protected static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}

package com.example.einvoice.service;

import com.example.einvoice.domain.FacturXProfile;
import com.example.einvoice.domain.Invoice;
import com.example.einvoice.domain.InvoiceFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Produces Factur-X hybrid invoices: CII XML from {@link CiiInvoiceGenerator},
 * embedded into a caller-supplied PDF by a {@link PdfAttachmentEmbedder}.
 *
 * This class never touches PDF internals itself.
 */
@Service
public class FacturXGenerator implements InvoiceGenerator {

    private static final Logger log = LoggerFactory.getLogger(FacturXGenerator.class);

    private final CiiInvoiceGenerator ciiGenerator;
    private final PdfAttachmentEmbedder embedder;

    public FacturXGenerator(CiiInvoiceGenerator ciiGenerator, PdfAttachmentEmbedder embedder) {
        this.ciiGenerator = ciiGenerator;
        this.embedder = embedder;
    }

    @Override
    public InvoiceFormat getFormat() {
        return InvoiceFormat.CII;
    }

    @Override
    public byte[] generateXml(Invoice invoice, FacturXProfile profile) {
        return ciiGenerator.generateXml(invoice, profile);
    }

    /**
     * A Factur-X document cannot exist without its visual part.
     *
     * @throws IllegalArgumentException always; use {@link #generate(Invoice, FacturXProfile, byte[])}
     */
    @Override
    public GenerationResult generate(Invoice invoice, FacturXProfile profile) {
        throw new IllegalArgumentException("A source PDF is required to generate a Factur-X invoice");
    }

    /**
     * Generates the XML with the configured default profile and embeds it.
     */
    public GenerationResult generate(Invoice invoice, byte[] sourcePdf) {
        return generate(invoice, ciiGenerator.getDefaultProfile(), sourcePdf);
    }

    /**
     * Generates the CII XML and embeds it into the source PDF.
     *
     * @param invoice The invoice
     * @param profile The Factur-X profile
     * @param sourcePdf The rendered invoice
     * @return XML and hybrid PDF
     * @throws IllegalArgumentException if no source PDF is given
     * @throws InvoiceEncodingException if the invoice cannot be encoded
     */
    public GenerationResult generate(Invoice invoice, FacturXProfile profile, byte[] sourcePdf) {
        if (sourcePdf == null || sourcePdf.length == 0) {
            throw new IllegalArgumentException("A source PDF is required to generate a Factur-X invoice");
        }
        byte[] xml = ciiGenerator.generateXml(invoice, profile);
        log.info("Generating Factur-X {} for invoice {}", profile, invoice.getNumber());
        byte[] pdf = embedder.embed(sourcePdf, xml, profile);
        return new GenerationResult(InvoiceFormat.CII, profile, xml, pdf);
    }
}

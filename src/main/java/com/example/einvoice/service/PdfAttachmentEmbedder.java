package com.example.einvoice.service;

import com.example.einvoice.domain.FacturXProfile;

/**
 * Turns a visual PDF and CII XML into a Factur-X hybrid document.
 */
public interface PdfAttachmentEmbedder {

    /**
     * @param sourcePdf the human-readable invoice
     * @param xml CII XML to attach
     * @param profile profile declared in the document metadata
     * @return the hybrid PDF
     * @throws DocumentProcessingException if the PDF cannot be read or written
     */
    byte[] embed(byte[] sourcePdf, byte[] xml, FacturXProfile profile);
}

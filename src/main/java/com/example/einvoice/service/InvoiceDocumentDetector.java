package com.example.einvoice.service;

import com.example.einvoice.domain.FacturXProfile;
import com.example.einvoice.domain.InvoiceFormat;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

/**
 * Identifies the syntax and profile of an invoice document from its own markers:
 * the root namespace gives the syntax, the CII guideline ID gives the profile.
 */
public final class InvoiceDocumentDetector {

    private InvoiceDocumentDetector() {
    }

    /**
     * @param profile the Factur-X profile for CII, null for UBL
     */
    public record DetectedDocument(InvoiceFormat format, FacturXProfile profile) {
    }

    /**
     * @throws IllegalArgumentException if the root namespace or the guideline ID is unknown
     */
    public static DetectedDocument detect(Document document) {
        Element root = document.getDocumentElement();
        String namespace = root.getNamespaceURI();

        if (CiiInvoiceGenerator.RSM_NS.equals(namespace)) {
            Element guideline = XmlSupport.firstElement(root, CiiInvoiceGenerator.RAM_NS,
                "GuidelineSpecifiedDocumentContextParameter");
            String guidelineId = guideline != null ? XmlSupport.text(guideline, CiiInvoiceGenerator.RAM_NS, "ID") : null;
            if (guidelineId == null) {
                throw new IllegalArgumentException("CII document without guideline ID");
            }
            return new DetectedDocument(InvoiceFormat.CII, FacturXProfile.fromGuidelineId(guidelineId));
        }
        if (UblInvoiceGenerator.INVOICE_NS.equals(namespace) || UblInvoiceGenerator.CREDIT_NOTE_NS.equals(namespace)) {
            return new DetectedDocument(InvoiceFormat.UBL, null);
        }
        throw new IllegalArgumentException("Unknown root namespace: " + namespace);
    }

    public static boolean isCreditNote(Document document) {
        return UblInvoiceGenerator.CREDIT_NOTE_NS.equals(document.getDocumentElement().getNamespaceURI());
    }
}

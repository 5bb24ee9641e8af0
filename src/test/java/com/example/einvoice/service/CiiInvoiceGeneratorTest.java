package com.example.einvoice.service;

import com.example.einvoice.TestInvoices;
import com.example.einvoice.domain.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import java.math.BigDecimal;
import java.util.List;

import static com.example.einvoice.service.CiiInvoiceGenerator.RAM_NS;
import static com.example.einvoice.service.CiiInvoiceGenerator.RSM_NS;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for CiiInvoiceGenerator.
 * Tests the Factur-X / ZUGFeRD CII output including:
 * - Document header and guideline ID per profile
 * - Profile-conditional sections (lines, notes, breakdowns)
 * - Monetary summation consistency
 * - Encoding-time failures
 */
class CiiInvoiceGeneratorTest {

    private CiiInvoiceGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new CiiInvoiceGenerator(new TaxCalculationService());
    }

    private static Document parse(byte[] xml) throws Exception {
        return XmlSupport.parse(xml);
    }

    private static String text(Document document, String localName) {
        NodeList nodes = document.getElementsByTagNameNS(RAM_NS, localName);
        return nodes.getLength() > 0 ? nodes.item(0).getTextContent() : null;
    }

    private static int count(Document document, String localName) {
        return document.getElementsByTagNameNS(RAM_NS, localName).getLength();
    }

    // ==================== Header Tests ====================

    @Test
    void generateXml_en16931_writesHeader() throws Exception {
        Document document = parse(generator.generateXml(TestInvoices.standard(), FacturXProfile.EN16931));

        Element root = document.getDocumentElement();
        assertEquals(RSM_NS, root.getNamespaceURI());
        assertEquals("CrossIndustryInvoice", root.getLocalName());
        assertEquals("urn:cen.eu:en16931:2017", text(document, "ID"));
        assertEquals("380", text(document, "TypeCode"));

        Element issue = (Element) document.getElementsByTagNameNS(CiiInvoiceGenerator.UDT_NS, "DateTimeString").item(0);
        assertEquals("20260915", issue.getTextContent());
        assertEquals("102", issue.getAttribute("format"));
    }

    @Test
    void generateXml_defaultProfileIsEn16931() throws Exception {
        Document document = parse(generator.generateXml(TestInvoices.standard()));

        assertEquals(FacturXProfile.EN16931.getGuidelineId(), text(document, "ID"));
    }

    @Test
    void generateXml_configuredDefaultProfile() throws Exception {
        CiiInvoiceGenerator extended = new CiiInvoiceGenerator(new TaxCalculationService(), "EXTENDED");

        Document document = parse(extended.generateXml(TestInvoices.standard()));

        assertEquals(FacturXProfile.EXTENDED.getGuidelineId(), text(document, "ID"));
    }

    @Test
    void generateXml_writesOperationCategoryNote() throws Exception {
        Document document = parse(generator.generateXml(TestInvoices.standard(), FacturXProfile.EN16931));

        NodeList subjects = document.getElementsByTagNameNS(RAM_NS, "SubjectCode");
        boolean found = false;
        for (int i = 0; i < subjects.getLength(); i++) {
            if ("AAI".equals(subjects.item(i).getTextContent())) {
                found = true;
            }
        }
        assertTrue(found);
    }

    // ==================== Totals Tests ====================

    @Test
    void generateXml_monetarySummationMatchesTaxEngine() throws Exception {
        Document document = parse(generator.generateXml(TestInvoices.standard(), FacturXProfile.EN16931));

        assertEquals("350.00", text(document, "TaxBasisTotalAmount"));
        assertEquals("41.00", text(document, "TaxTotalAmount"));
        assertEquals("391.00", text(document, "GrandTotalAmount"));
        assertEquals("391.00", text(document, "DuePayableAmount"));
        assertEquals(2, count(document, "IncludedSupplyChainTradeLineItem"));
        // one ApplicableTradeTax per line plus one per summary
        assertEquals(4, count(document, "ApplicableTradeTax"));
    }

    @Test
    void generateXml_taxTotalCarriesCurrency() throws Exception {
        Document document = parse(generator.generateXml(TestInvoices.standard(), FacturXProfile.EN16931));

        Element taxTotal = (Element) document.getElementsByTagNameNS(RAM_NS, "TaxTotalAmount").item(0);
        assertEquals("EUR", taxTotal.getAttribute("currencyID"));
    }

    @Test
    void generateXml_prepaidAmount_reducesDuePayable() throws Exception {
        Invoice invoice = TestInvoices.standardBuilder().prepaidAmount(new BigDecimal("100")).build();

        Document document = parse(generator.generateXml(invoice, FacturXProfile.EN16931));

        assertEquals("100.00", text(document, "TotalPrepaidAmount"));
        assertEquals("291.00", text(document, "DuePayableAmount"));
    }

    // ==================== Profile Tests ====================

    @Test
    void generateXml_minimum_omitsLinesAndBreakdown() throws Exception {
        Document document = parse(generator.generateXml(TestInvoices.standard(), FacturXProfile.MINIMUM));

        assertEquals(FacturXProfile.MINIMUM.getGuidelineId(), text(document, "ID"));
        assertEquals(0, count(document, "IncludedSupplyChainTradeLineItem"));
        assertEquals(0, count(document, "ApplicableTradeTax"));
        assertEquals(0, count(document, "IncludedNote"));
        assertEquals(0, count(document, "LineTotalAmount"));
        assertEquals("391.00", text(document, "GrandTotalAmount"));
    }

    @Test
    void generateXml_basicWl_hasBreakdownWithoutLines() throws Exception {
        Document document = parse(generator.generateXml(TestInvoices.standard(), FacturXProfile.BASIC_WL));

        assertEquals(0, count(document, "IncludedSupplyChainTradeLineItem"));
        assertEquals(2, count(document, "ApplicableTradeTax"));
        assertEquals("350.00", text(document, "LineTotalAmount"));
    }

    @Test
    void generateXml_basic_omitsOrderReference() throws Exception {
        Document document = parse(generator.generateXml(TestInvoices.standard(), FacturXProfile.BASIC));

        assertEquals(2, count(document, "IncludedSupplyChainTradeLineItem"));
        assertEquals(0, count(document, "BuyerOrderReferencedDocument"));
        assertEquals(0, count(document, "BICID"));
    }

    @Test
    void generateXml_en16931_writesOrderReferenceAndBic() throws Exception {
        Document document = parse(generator.generateXml(TestInvoices.standard(), FacturXProfile.EN16931));

        assertEquals(1, count(document, "BuyerOrderReferencedDocument"));
        assertEquals("AGRIFRPP", text(document, "BICID"));
        assertEquals("FR7630006000011234567890189", text(document, "IBANID"));
    }

    @Test
    void generateXml_extended_writesSubLines() throws Exception {
        InvoiceLine kit = InvoiceLine.builder()
            .description("Kit optique")
            .quantity("1")
            .unitPrice("100.00")
            .addSubLine(TestInvoices.line("Monture", "1", "60.00", "20.0"))
            .addSubLine(TestInvoices.line("Verres", "1", "40.00", "20.0"))
            .build();
        Invoice invoice = TestInvoices.standardBuilder().lines(List.of(kit)).build();

        Document en16931 = parse(generator.generateXml(invoice, FacturXProfile.EN16931));
        Document extended = parse(generator.generateXml(invoice, FacturXProfile.EXTENDED));

        assertEquals(1, count(en16931, "IncludedSupplyChainTradeLineItem"));
        assertEquals(3, count(extended, "IncludedSupplyChainTradeLineItem"));
        assertEquals("1", text(extended, "ParentLineID"));
        assertEquals("INFORMATION", text(extended, "LineStatusReasonCode"));
        // sub-lines are informational: totals unchanged
        assertEquals("100.00", text(extended, "TaxBasisTotalAmount"));
    }

    @Test
    void generateXml_reverseCharge_writesExemptionCode() throws Exception {
        InvoiceLine reverse = InvoiceLine.builder()
            .description("Travaux")
            .quantity("1")
            .unitPrice("1000.00")
            .vatRate("0")
            .vatCategory(VatCategory.REVERSE_CHARGE)
            .exemption("Autoliquidation", "VATEX-FR-AE")
            .build();
        Invoice invoice = TestInvoices.standardBuilder().lines(List.of(reverse)).build();

        Document document = parse(generator.generateXml(invoice, FacturXProfile.EN16931));

        assertEquals("AE", text(document, "CategoryCode"));
        assertEquals("VATEX-FR-AE", text(document, "ExemptionReasonCode"));
        assertEquals("0.00", text(document, "TaxTotalAmount"));
    }

    @Test
    void generateXml_vatOnDebits_writesDueDateTypeCode() throws Exception {
        Invoice invoice = TestInvoices.standardBuilder().vatOnDebits(true).build();

        Document document = parse(generator.generateXml(invoice, FacturXProfile.EN16931));

        assertEquals("5", text(document, "DueDateTypeCode"));
    }

    // ==================== Failure Tests ====================

    @Test
    void generateXml_nullProfile_throws() {
        assertThrows(InvoiceEncodingException.class,
            () -> generator.generateXml(TestInvoices.standard(), null));
    }

    @Test
    void generateXml_creditNoteWithoutPrecedingReference_throws() {
        Invoice creditNote = TestInvoices.standardBuilder().typeCode(InvoiceTypeCode.CREDIT_NOTE).build();

        InvoiceEncodingException e = assertThrows(InvoiceEncodingException.class,
            () -> generator.generateXml(creditNote, FacturXProfile.EN16931));
        assertTrue(e.getMessage().contains("preceding invoice reference"));
    }

    @Test
    void generateXml_amountDueWithoutDueDateOrTerms_throws() {
        Invoice invoice = TestInvoices.standardBuilder().dueDate(null).paymentTerms(null).build();

        InvoiceEncodingException e = assertThrows(InvoiceEncodingException.class,
            () -> generator.generateXml(invoice, FacturXProfile.EN16931));
        assertTrue(e.getMessage().startsWith("[BR-CO-25]"));
    }

    @Test
    void generateXml_amountDueWithoutDueDate_allowedBelowEn16931() {
        Invoice invoice = TestInvoices.standardBuilder().dueDate(null).paymentTerms(null).build();

        assertDoesNotThrow(() -> generator.generateXml(invoice, FacturXProfile.BASIC));
    }

    @Test
    void generateXml_fullyPrepaid_needsNoDueDate() {
        Invoice invoice = TestInvoices.standardBuilder()
            .dueDate(null)
            .paymentTerms(null)
            .prepaidAmount(new BigDecimal("391.00"))
            .build();

        assertDoesNotThrow(() -> generator.generateXml(invoice, FacturXProfile.EN16931));
    }
}

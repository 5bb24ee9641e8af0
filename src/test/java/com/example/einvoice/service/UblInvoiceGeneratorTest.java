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
import java.util.Locale;

import static com.example.einvoice.service.UblInvoiceGenerator.CAC_NS;
import static com.example.einvoice.service.UblInvoiceGenerator.CBC_NS;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for UblInvoiceGenerator.
 */
class UblInvoiceGeneratorTest {

    private UblInvoiceGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new UblInvoiceGenerator(new TaxCalculationService());
    }

    private static String text(Document document, String localName) {
        NodeList nodes = document.getElementsByTagNameNS(CBC_NS, localName);
        return nodes.getLength() > 0 ? nodes.item(0).getTextContent() : null;
    }

    private static String monetaryTotal(Document document, String localName) {
        Element total = (Element) document.getElementsByTagNameNS(CAC_NS, "LegalMonetaryTotal").item(0);
        return XmlSupport.text(total, CBC_NS, localName);
    }

    private static Invoice creditNote(InvoiceTypeCode typeCode) {
        return TestInvoices.standardBuilder()
            .number("AV-2026-003")
            .typeCode(typeCode)
            .precedingInvoiceReference("FA-2026-001")
            .build();
    }

    // ==================== Root Tests ====================

    @Test
    void generateXml_invoice_usesInvoiceRoot() throws Exception {
        Document document = XmlSupport.parse(generator.generateXml(TestInvoices.standard(), FacturXProfile.EN16931));

        Element root = document.getDocumentElement();
        assertEquals(UblInvoiceGenerator.INVOICE_NS, root.getNamespaceURI());
        assertEquals("Invoice", root.getLocalName());
        assertEquals("380", text(document, "InvoiceTypeCode"));
        assertEquals(2, document.getElementsByTagNameNS(CAC_NS, "InvoiceLine").getLength());
    }

    @Test
    void generateXml_creditNote_usesCreditNoteRoot() throws Exception {
        Document document = XmlSupport.parse(
            generator.generateXml(creditNote(InvoiceTypeCode.CREDIT_NOTE), FacturXProfile.EN16931));

        Element root = document.getDocumentElement();
        assertEquals(UblInvoiceGenerator.CREDIT_NOTE_NS, root.getNamespaceURI());
        assertEquals("CreditNote", root.getLocalName());
        assertEquals("381", text(document, "CreditNoteTypeCode"));
        assertNull(text(document, "InvoiceTypeCode"));
        assertEquals(2, document.getElementsByTagNameNS(CAC_NS, "CreditNoteLine").getLength());
        assertNotNull(text(document, "CreditedQuantity"));

        Element billing = (Element) document.getElementsByTagNameNS(CAC_NS, "InvoiceDocumentReference").item(0);
        assertEquals("FA-2026-001", XmlSupport.text(billing, CBC_NS, "ID"));
    }

    @Test
    void generateXml_correctedInvoice_usesCreditNoteRoot() throws Exception {
        Document document = XmlSupport.parse(
            generator.generateXml(creditNote(InvoiceTypeCode.CORRECTED_INVOICE), FacturXProfile.EN16931));

        assertEquals("CreditNote", document.getDocumentElement().getLocalName());
        assertEquals("384", text(document, "CreditNoteTypeCode"));
    }

    // ==================== Header Tests ====================

    @Test
    void generateXml_en16931Customization_hasNoProfileId() throws Exception {
        Document document = XmlSupport.parse(generator.generateXml(TestInvoices.standard(), UblCustomization.EN16931));

        assertEquals("urn:cen.eu:en16931:2017", text(document, "CustomizationID"));
        assertNull(text(document, "ProfileID"));
        assertEquals("FA-2026-001", text(document, "ID"));
        assertEquals("2026-09-15", text(document, "IssueDate"));
        assertEquals("2026-10-15", text(document, "DueDate"));
        assertEquals("EUR", text(document, "DocumentCurrencyCode"));
        assertEquals("SERVICE-ACHATS", text(document, "BuyerReference"));
    }

    @Test
    void generateXml_peppol_writesProfileId() throws Exception {
        Document document = XmlSupport.parse(
            generator.generateXml(TestInvoices.standard(), FacturXProfile.EN16931, UblCustomization.PEPPOL_BIS_3));

        assertEquals(UblCustomization.PEPPOL_BIS_3.getCustomizationId(), text(document, "CustomizationID"));
        assertEquals("urn:fdc:peppol.eu:2017:poacc:billing:01:1.0", text(document, "ProfileID"));
        assertEquals(TestInvoices.SELLER_SIREN, text(document, "EndpointID"));
    }

    @Test
    void generateXml_writesOperationCategoryNote() throws Exception {
        Document document = XmlSupport.parse(generator.generateXml(TestInvoices.standard(), FacturXProfile.EN16931));

        NodeList notes = document.getElementsByTagNameNS(CBC_NS, "Note");
        boolean found = false;
        for (int i = 0; i < notes.getLength(); i++) {
            if (notes.item(i).getTextContent().startsWith("#AAI#")) {
                found = true;
            }
        }
        assertTrue(found);
    }

    // ==================== Totals Tests ====================

    @Test
    void generateXml_totalsMatchTaxEngine() throws Exception {
        Document document = XmlSupport.parse(generator.generateXml(TestInvoices.standard(), FacturXProfile.EN16931));

        assertEquals("350.00", monetaryTotal(document, "LineExtensionAmount"));
        assertEquals("350.00", monetaryTotal(document, "TaxExclusiveAmount"));
        assertEquals("391.00", monetaryTotal(document, "TaxInclusiveAmount"));
        assertEquals("391.00", monetaryTotal(document, "PayableAmount"));
        assertNull(monetaryTotal(document, "PrepaidAmount"));
        assertEquals(2, document.getElementsByTagNameNS(CAC_NS, "TaxSubtotal").getLength());

        Element taxTotal = (Element) document.getElementsByTagNameNS(CAC_NS, "TaxTotal").item(0);
        Element taxAmount = XmlSupport.firstElement(taxTotal, CBC_NS, "TaxAmount");
        assertEquals("41.00", taxAmount.getTextContent());
        assertEquals("EUR", taxAmount.getAttribute("currencyID"));
    }

    @Test
    void generateXml_positiveCreditNote_keepsAmountsAsComputed() throws Exception {
        Document document = XmlSupport.parse(
            generator.generateXml(creditNote(InvoiceTypeCode.CREDIT_NOTE), FacturXProfile.EN16931));

        assertEquals("391.00", monetaryTotal(document, "PayableAmount"));
        assertFalse(monetaryTotal(document, "TaxInclusiveAmount").startsWith("-"));
    }

    @Test
    void generateXml_creditNoteWithMixedSignLines_linesSumToHeader() throws Exception {
        Invoice invoice = TestInvoices.standardBuilder()
            .number("AV-2026-004")
            .typeCode(InvoiceTypeCode.CREDIT_NOTE)
            .precedingInvoiceReference("FA-2026-001")
            .lines(List.of(
                TestInvoices.line("Retour monture", "-1", "100.00", "20.0"),
                TestInvoices.line("Frais de reprise", "1", "30.00", "20.0")))
            .build();

        Document document = XmlSupport.parse(generator.generateXml(invoice, FacturXProfile.EN16931));

        NodeList lines = document.getElementsByTagNameNS(CAC_NS, "CreditNoteLine");
        assertEquals(2, lines.getLength());
        Element returned = (Element) lines.item(0);
        Element fee = (Element) lines.item(1);
        assertEquals("100.00", XmlSupport.text(returned, CBC_NS, "LineExtensionAmount"));
        assertEquals("-30.00", XmlSupport.text(fee, CBC_NS, "LineExtensionAmount"));
        assertTrue(XmlSupport.text(fee, CBC_NS, "CreditedQuantity").startsWith("-"));
        assertFalse(XmlSupport.text(returned, CBC_NS, "CreditedQuantity").startsWith("-"));

        BigDecimal lineSum = new BigDecimal(XmlSupport.text(returned, CBC_NS, "LineExtensionAmount"))
            .add(new BigDecimal(XmlSupport.text(fee, CBC_NS, "LineExtensionAmount")));
        assertEquals(0, lineSum.compareTo(new BigDecimal(monetaryTotal(document, "LineExtensionAmount"))));
        assertEquals("70.00", monetaryTotal(document, "LineExtensionAmount"));
        assertEquals("84.00", monetaryTotal(document, "TaxInclusiveAmount"));
        assertEquals("84.00", monetaryTotal(document, "PayableAmount"));

        Element taxTotal = (Element) document.getElementsByTagNameNS(CAC_NS, "TaxTotal").item(0);
        assertEquals("14.00", XmlSupport.firstElement(taxTotal, CBC_NS, "TaxAmount").getTextContent());
    }

    @Test
    void generateXml_creditNoteWithPrepaidAboveGross_payableIsNegative() throws Exception {
        Invoice invoice = TestInvoices.standardBuilder()
            .number("AV-2026-005")
            .typeCode(InvoiceTypeCode.CREDIT_NOTE)
            .precedingInvoiceReference("FA-2026-001")
            .prepaidAmount(new BigDecimal("1000.00"))
            .build();

        Document document = XmlSupport.parse(generator.generateXml(invoice, FacturXProfile.EN16931));

        BigDecimal inclusive = new BigDecimal(monetaryTotal(document, "TaxInclusiveAmount"));
        BigDecimal prepaid = new BigDecimal(monetaryTotal(document, "PrepaidAmount"));
        BigDecimal payable = new BigDecimal(monetaryTotal(document, "PayableAmount"));
        assertEquals("391.00", inclusive.toPlainString());
        assertEquals("1000.00", prepaid.toPlainString());
        assertEquals("-609.00", payable.toPlainString());
        assertEquals(0, inclusive.subtract(prepaid).compareTo(payable));
    }

    @Test
    void generateXml_writesPaymentAccount() throws Exception {
        Document document = XmlSupport.parse(generator.generateXml(TestInvoices.standard(), FacturXProfile.EN16931));

        Element account = (Element) document.getElementsByTagNameNS(CAC_NS, "PayeeFinancialAccount").item(0);
        assertEquals("FR7630006000011234567890189", XmlSupport.text(account, CBC_NS, "ID"));
        assertEquals(PaymentMeansCode.SEPA_CREDIT_TRANSFER.getCode(), text(document, "PaymentMeansCode"));
    }

    // ==================== Failure Tests ====================

    @Test
    void generateXml_basicProfile_throws() {
        InvoiceEncodingException e = assertThrows(InvoiceEncodingException.class,
            () -> generator.generateXml(TestInvoices.standard(), FacturXProfile.BASIC));
        assertTrue(e.getMessage().startsWith("Unknown profile for UBL"));
        assertTrue(e.getMessage().contains("EN16931, EXTENDED"));
    }

    @Test
    void generateXml_nullProfile_throws() {
        assertThrows(InvoiceEncodingException.class,
            () -> generator.generateXml(TestInvoices.standard(), (FacturXProfile) null));
    }

    @Test
    void generateXml_peppolWithoutBuyerSiren_throws() {
        Party foreignBuyer = Party.builder()
            .name("Brillen GmbH")
            .vatNumber("DE123456789")
            .address(new Address("Hauptstrasse 1", null, "Berlin", "10115", "DE", null))
            .build();
        Invoice invoice = TestInvoices.standardBuilder().buyer(foreignBuyer).build();

        InvoiceEncodingException e = assertThrows(InvoiceEncodingException.class,
            () -> generator.generateXml(invoice, FacturXProfile.EN16931, UblCustomization.PEPPOL_BIS_3));
        assertTrue(e.getMessage().toLowerCase(Locale.ROOT).contains("buyer electronic address"));
    }

    @Test
    void generateXml_peppolWithoutBuyerReference_throws() {
        Invoice invoice = TestInvoices.standardBuilder()
            .buyerReference(null)
            .purchaseOrderReference(null)
            .build();

        assertThrows(InvoiceEncodingException.class,
            () -> generator.generateXml(invoice, FacturXProfile.EN16931, UblCustomization.PEPPOL_BIS_3));
        assertDoesNotThrow(() -> generator.generateXml(invoice, FacturXProfile.EN16931, UblCustomization.EN16931));
    }
}

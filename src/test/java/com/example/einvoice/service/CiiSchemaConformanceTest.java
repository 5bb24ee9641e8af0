package com.example.einvoice.service;

import com.example.einvoice.TestInvoices;
import com.example.einvoice.domain.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.Resource;
import org.springframework.core.io.UrlResource;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.JarURLConnection;
import java.net.URL;
import java.time.LocalDate;
import java.util.Enumeration;
import java.util.List;
import java.util.Locale;
import java.util.jar.JarEntry;
import java.util.jar.JarFile;

import static com.example.einvoice.service.CiiInvoiceGenerator.RAM_NS;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Generated CII checked against the complete UN/CEFACT CII D16B schema shipped in ph-cii-d16b.
 * Every Factur-X profile is a restriction of it, so each profile's output must pass.
 */
class CiiSchemaConformanceTest {

    private static final String D16B_JAR = "ph-cii-d16b";

    private SchemaValidationService service;
    private CiiInvoiceGenerator generator;
    private Resource schema;

    @BeforeEach
    void setUp() throws IOException {
        service = new SchemaValidationService("classpath:test-schemas");
        generator = new CiiInvoiceGenerator(new TaxCalculationService());
        schema = d16bSchema();
    }

    /**
     * Locates CrossIndustryInvoice_100pD16B.xsd inside the ph-cii-d16b jar, whatever its directory.
     */
    private static Resource d16bSchema() throws IOException {
        Enumeration<URL> manifests = CiiSchemaConformanceTest.class.getClassLoader()
            .getResources("META-INF/MANIFEST.MF");
        while (manifests.hasMoreElements()) {
            URL manifest = manifests.nextElement();
            String url = manifest.toExternalForm();
            if (!url.startsWith("jar:") || !url.contains(D16B_JAR)) {
                continue;
            }
            String root = url.substring(0, url.indexOf("!/") + 2);
            JarURLConnection connection = (JarURLConnection) manifest.openConnection();
            connection.setUseCaches(false);
            try (JarFile jar = connection.getJarFile()) {
                Enumeration<JarEntry> entries = jar.entries();
                while (entries.hasMoreElements()) {
                    String name = entries.nextElement().getName();
                    String fileName = name.substring(name.lastIndexOf('/') + 1);
                    if (fileName.startsWith("CrossIndustryInvoice")
                            && fileName.toUpperCase(Locale.ROOT).contains("D16B")
                            && fileName.endsWith(".xsd")
                            && !fileName.contains("urn")) {
                        return new UrlResource(root + name);
                    }
                }
            }
        }
        throw new IllegalStateException("CII D16B schema not found on the test classpath");
    }

    /**
     * Exercises every optional section the writer knows about.
     */
    private static Invoice fullInvoice() {
        Party payee = Party.builder()
            .name("Factor Finance SA")
            .siren("552081317")
            .address(new Address("1 place de la Bourse", "Paris", "75002"))
            .build();
        Party buyer = Party.builder()
            .name("LunettesPlus SA")
            .siren(TestInvoices.BUYER_SIREN)
            .vatNumber("FR98765432101")
            .email("compta@lunettesplus.fr")
            .address(new Address("5 avenue de la Vision", "Bâtiment B", "Paris", "75011", "FR", "Île-de-France"))
            .deliveryAddress(new Address("ZI des Lentilles", "Lyon", "69007"))
            .build();
        InvoiceLine frames = InvoiceLine.builder()
            .description("Monture acétate")
            .quantity("100")
            .unitPrice("2.00")
            .vatRate("5.5")
            .sellerItemReference("MON-ACE-01")
            .buyerItemReference("ART-778")
            .billingPeriod(LocalDate.of(2026, 9, 1), LocalDate.of(2026, 9, 30))
            .discountAmount(new BigDecimal("10.00"))
            .chargeAmount(new BigDecimal("4.00"))
            .addSubLine(TestInvoices.line("Charnière flex", "100", "0.50", "5.5"))
            .build();
        InvoiceLine training = InvoiceLine.builder()
            .description("Formation agréée")
            .quantity("1")
            .unitPrice("300.00")
            .vatRate("0")
            .vatCategory(VatCategory.EXEMPT)
            .exemption("Exonération article 261-4-4 du CGI", "VATEX-FR-261-4")
            .build();

        return TestInvoices.standardBuilder()
            .buyer(buyer)
            .payee(payee)
            .note("Livraison en deux colis")
            .vatOnDebits(true)
            .contractReference("CT-2026-05")
            .buyerAccountingReference("411-LUNETTES")
            .billingPeriod(LocalDate.of(2026, 9, 1), LocalDate.of(2026, 9, 30))
            .prepaidAmount(new BigDecimal("50.00"))
            .lines(List.of(frames, TestInvoices.line("Verres progressifs", "50", "3.00", "20.0"), training))
            .build();
    }

    // ==================== Profile Tests ====================

    @Test
    void validate_standardInvoice_everyProfilePasses() {
        for (FacturXProfile profile : FacturXProfile.values()) {
            byte[] xml = generator.generateXml(TestInvoices.standard(), profile);

            assertEquals(List.of(), service.validate(xml, schema), "profile " + profile);
        }
    }

    @Test
    void validate_fullInvoice_everyProfilePasses() {
        Invoice invoice = fullInvoice();
        for (FacturXProfile profile : FacturXProfile.values()) {
            byte[] xml = generator.generateXml(invoice, profile);

            assertEquals(List.of(), service.validate(xml, schema), "profile " + profile);
        }
    }

    @Test
    void validate_creditNote_passes() {
        Invoice creditNote = TestInvoices.standardBuilder()
            .number("AV-2026-003")
            .typeCode(InvoiceTypeCode.CREDIT_NOTE)
            .precedingInvoiceReference("FA-2026-001")
            .build();

        byte[] xml = generator.generateXml(creditNote, FacturXProfile.EN16931);

        assertEquals(List.of(), service.validate(xml, schema));
    }

    // ==================== Structure Tests ====================

    @Test
    void validate_lineChildrenOutOfOrder_reportsError() throws Exception {
        Document document = XmlSupport.parse(generator.generateXml(TestInvoices.standard(), FacturXProfile.EN16931));
        Element item = (Element) document.getElementsByTagNameNS(RAM_NS, "IncludedSupplyChainTradeLineItem").item(0);
        Element lineDocument = XmlSupport.firstElement(item, RAM_NS, "AssociatedDocumentLineDocument");
        Element product = XmlSupport.firstElement(item, RAM_NS, "SpecifiedTradeProduct");
        item.insertBefore(product, lineDocument);

        List<String> errors = service.validate(XmlSupport.toBytes(document), schema);

        assertFalse(errors.isEmpty());
        assertTrue(errors.get(0).startsWith("Line "), errors.get(0));
    }

    @Test
    void validate_unknownSettlementElement_reportsError() throws Exception {
        Document document = XmlSupport.parse(generator.generateXml(TestInvoices.standard(), FacturXProfile.EN16931));
        Element settlement = (Element) document.getElementsByTagNameNS(RAM_NS, "ApplicableHeaderTradeSettlement").item(0);
        XmlSupport.append(settlement, RAM_NS, "ram:SettlementDiscount", "5.00");

        assertFalse(service.validate(XmlSupport.toBytes(document), schema).isEmpty());
    }
}

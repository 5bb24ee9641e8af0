package com.example.einvoice.service;

import com.example.einvoice.domain.FacturXProfile;
import com.lowagie.text.pdf.PdfArray;
import com.lowagie.text.pdf.PdfFileSpecification;
import com.lowagie.text.pdf.PdfName;
import com.lowagie.text.pdf.PdfReader;
import com.lowagie.text.pdf.PdfStamper;
import com.lowagie.text.pdf.PdfString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Embeds the CII XML into an existing PDF with OpenPDF.
 *
 * Attaches the XML as an embedded file with AFRelationship Data, references it
 * from the catalog /AF array and writes the Factur-X extension schema into the
 * XMP metadata. Conversion of the source to PDF/A-3 (fonts, colour profiles)
 * is left to the renderer that produced it.
 */
@Service
public class OpenPdfAttachmentEmbedder implements PdfAttachmentEmbedder {

    private static final Logger log = LoggerFactory.getLogger(OpenPdfAttachmentEmbedder.class);

    private static final PdfName AF_RELATIONSHIP = new PdfName("AFRelationship");
    private static final PdfName AF = new PdfName("AF");
    private static final PdfName DATA = new PdfName("Data");

    private static final String XMP_TEMPLATE = """
        <?xpacket begin="\uFEFF" id="W5M0MpCehiHzreSzNTczkc9d"?>
        <x:xmpmeta xmlns:x="adobe:ns:meta/">
          <rdf:RDF xmlns:rdf="http://www.w3.org/1999/02/22-rdf-syntax-ns#">
            <rdf:Description rdf:about=""
                xmlns:pdfaid="http://www.aiim.org/pdfa/ns/id/">
              <pdfaid:part>3</pdfaid:part>
              <pdfaid:conformance>B</pdfaid:conformance>
            </rdf:Description>
            <rdf:Description rdf:about=""
                xmlns:pdfaExtension="http://www.aiim.org/pdfa/ns/extension/"
                xmlns:pdfaSchema="http://www.aiim.org/pdfa/ns/schema#"
                xmlns:pdfaProperty="http://www.aiim.org/pdfa/ns/property#">
              <pdfaExtension:schemas>
                <rdf:Bag>
                  <rdf:li rdf:parseType="Resource">
                    <pdfaSchema:schema>Factur-X PDFA Extension Schema</pdfaSchema:schema>
                    <pdfaSchema:namespaceURI>urn:factur-x:pdfa:CrossIndustryDocument:invoice:1p0#</pdfaSchema:namespaceURI>
                    <pdfaSchema:prefix>fx</pdfaSchema:prefix>
                    <pdfaSchema:property>
                      <rdf:Seq>
                        <rdf:li rdf:parseType="Resource">
                          <pdfaProperty:name>DocumentFileName</pdfaProperty:name>
                          <pdfaProperty:valueType>Text</pdfaProperty:valueType>
                          <pdfaProperty:category>external</pdfaProperty:category>
                          <pdfaProperty:description>The name of the embedded XML document</pdfaProperty:description>
                        </rdf:li>
                        <rdf:li rdf:parseType="Resource">
                          <pdfaProperty:name>DocumentType</pdfaProperty:name>
                          <pdfaProperty:valueType>Text</pdfaProperty:valueType>
                          <pdfaProperty:category>external</pdfaProperty:category>
                          <pdfaProperty:description>The type of the hybrid document in capital letters, e.g. INVOICE or ORDER</pdfaProperty:description>
                        </rdf:li>
                        <rdf:li rdf:parseType="Resource">
                          <pdfaProperty:name>Version</pdfaProperty:name>
                          <pdfaProperty:valueType>Text</pdfaProperty:valueType>
                          <pdfaProperty:category>external</pdfaProperty:category>
                          <pdfaProperty:description>The actual version of the standard applying to the embedded XML document</pdfaProperty:description>
                        </rdf:li>
                        <rdf:li rdf:parseType="Resource">
                          <pdfaProperty:name>ConformanceLevel</pdfaProperty:name>
                          <pdfaProperty:valueType>Text</pdfaProperty:valueType>
                          <pdfaProperty:category>external</pdfaProperty:category>
                          <pdfaProperty:description>The conformance level of the embedded XML document</pdfaProperty:description>
                        </rdf:li>
                      </rdf:Seq>
                    </pdfaSchema:property>
                  </rdf:li>
                </rdf:Bag>
              </pdfaExtension:schemas>
            </rdf:Description>
            <rdf:Description rdf:about=""
                xmlns:fx="urn:factur-x:pdfa:CrossIndustryDocument:invoice:1p0#">
              <fx:DocumentType>INVOICE</fx:DocumentType>
              <fx:DocumentFileName>%s</fx:DocumentFileName>
              <fx:Version>1.0</fx:Version>
              <fx:ConformanceLevel>%s</fx:ConformanceLevel>
            </rdf:Description>
          </rdf:RDF>
        </x:xmpmeta>
        <?xpacket end="w"?>
        """;

    private final String attachmentName;

    @Autowired
    public OpenPdfAttachmentEmbedder(@Value("${einvoice.facturx.attachment-name:factur-x.xml}") String attachmentName) {
        this.attachmentName = attachmentName;
    }

    public OpenPdfAttachmentEmbedder() {
        this("factur-x.xml");
    }

    public String getAttachmentName() {
        return attachmentName;
    }

    @Override
    public byte[] embed(byte[] sourcePdf, byte[] xml, FacturXProfile profile) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            PdfReader reader = new PdfReader(sourcePdf);
            PdfStamper stamper = new PdfStamper(reader, baos);

            PdfFileSpecification fileSpec = PdfFileSpecification.fileEmbedded(
                stamper.getWriter(), null, attachmentName, xml);
            fileSpec.put(AF_RELATIONSHIP, DATA);
            fileSpec.put(PdfName.DESC, new PdfString("Factur-X invoice " + profile.getSchemaName()));
            stamper.addFileAttachment(attachmentName, fileSpec);

            PdfArray associatedFiles = new PdfArray();
            associatedFiles.add(fileSpec.getReference());
            stamper.getWriter().getExtraCatalog().put(AF, associatedFiles);

            String xmp = String.format(XMP_TEMPLATE, attachmentName, profile.getConformanceLevel());
            stamper.setXmpMetadata(xmp.getBytes(StandardCharsets.UTF_8));

            stamper.close();
            reader.close();

            byte[] result = baos.toByteArray();
            log.info("Embedded {} ({} bytes, profile {}) into PDF: {} bytes",
                attachmentName, xml.length, profile, result.length);
            return result;
        } catch (Exception e) {
            log.error("Failed to embed {} into PDF", attachmentName, e);
            throw new DocumentProcessingException("Failed to embed Factur-X XML: " + e.getMessage(), e);
        }
    }
}

package com.example.einvoice.service;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * DOM helpers shared by the generators and validators.
 *
 * Parsers refuse DOCTYPE declarations and external entities.
 */
public final class XmlSupport {

    /** UN/CEFACT date format 102. */
    public static final DateTimeFormatter FORMAT_102 = DateTimeFormatter.BASIC_ISO_DATE;

    private XmlSupport() {
    }

    public static DocumentBuilder newDocumentBuilder() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newDefaultInstance();
            factory.setNamespaceAware(true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            return factory.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new DocumentProcessingException("XML parser configuration failed: " + e.getMessage(), e);
        }
    }

    public static Document newDocument() {
        return newDocumentBuilder().newDocument();
    }

    public static Document parse(byte[] xml) throws SAXException, IOException {
        return newDocumentBuilder().parse(new ByteArrayInputStream(xml));
    }

    public static byte[] toBytes(Document document) {
        try (ByteArrayOutputStream baos = new ByteArrayOutputStream()) {
            TransformerFactory factory = TransformerFactory.newDefaultInstance();
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
            factory.setAttribute(XMLConstants.ACCESS_EXTERNAL_STYLESHEET, "");
            Transformer transformer = factory.newTransformer();
            transformer.setOutputProperty(OutputKeys.ENCODING, StandardCharsets.UTF_8.name());
            transformer.setOutputProperty(OutputKeys.INDENT, "yes");
            transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");
            document.setXmlStandalone(true);
            transformer.transform(new DOMSource(document), new StreamResult(baos));
            return baos.toByteArray();
        } catch (TransformerException | IOException e) {
            throw new DocumentProcessingException("XML serialisation failed: " + e.getMessage(), e);
        }
    }

    /**
     * Appends a namespaced child element.
     */
    public static Element append(Element parent, String namespace, String qualifiedName) {
        Element child = parent.getOwnerDocument().createElementNS(namespace, qualifiedName);
        parent.appendChild(child);
        return child;
    }

    /**
     * Appends a namespaced child element holding text.
     */
    public static Element append(Element parent, String namespace, String qualifiedName, String text) {
        Element child = append(parent, namespace, qualifiedName);
        child.setTextContent(text);
        return child;
    }

    /**
     * First direct or nested child with the given namespace and local name, or null.
     */
    public static Element firstElement(Element parent, String namespace, String localName) {
        var nodes = parent.getElementsByTagNameNS(namespace, localName);
        return nodes.getLength() > 0 ? (Element) nodes.item(0) : null;
    }

    public static String text(Element parent, String namespace, String localName) {
        Element element = firstElement(parent, namespace, localName);
        return element != null ? element.getTextContent().trim() : null;
    }

    public static String formatAmount(BigDecimal amount, int scale) {
        return amount.setScale(scale, RoundingMode.HALF_UP).toPlainString();
    }

    public static String formatQuantity(BigDecimal quantity) {
        return quantity.stripTrailingZeros().toPlainString();
    }

    public static String formatRate(BigDecimal rate) {
        return rate.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    public static String formatDate102(LocalDate date) {
        return date.format(FORMAT_102);
    }
}

package com.example.einvoice.service;

import com.example.einvoice.domain.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.SAXException;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Writes and reads lifecycle status messages in the CDAR D22B syntax
 * (Cross Domain Acknowledgement and Response) used by AFNOR XP Z12-012.
 */
@Service
public class CdarMessageService {

    private static final Logger log = LoggerFactory.getLogger(CdarMessageService.class);

    public static final String RSM_NS = "urn:un:unece:uncefact:data:standard:CrossDomainAcknowledgementAndResponse:100";
    public static final String RAM_NS = CiiInvoiceGenerator.RAM_NS;
    public static final String UDT_NS = CiiInvoiceGenerator.UDT_NS;

    public static final String GUIDELINE_ID = "urn:factur-x.eu:1p0:cdar";
    public static final String TYPE_CODE = "YC2";

    /**
     * Builds a message announcing a lifecycle event.
     */
    public CdarMessage fromEvent(LifecycleEvent event, String invoiceReference,
                                 CdarParty sender, List<CdarParty> recipients) {
        return new CdarMessage(
            UUID.randomUUID().toString(),
            LocalDate.ofInstant(event.timestamp(), ZoneOffset.UTC),
            event.status(),
            invoiceReference,
            sender,
            recipients,
            event.reason(),
            event.reasonCode(),
            event.amount()
        );
    }

    /**
     * Serialises a message to CDAR XML.
     */
    public byte[] generateXml(CdarMessage message) {
        Document document = XmlSupport.newDocument();
        Element root = document.createElementNS(RSM_NS, "rsm:CrossDomainAcknowledgementAndResponse");
        root.setAttributeNS("http://www.w3.org/2000/xmlns/", "xmlns:ram", RAM_NS);
        root.setAttributeNS("http://www.w3.org/2000/xmlns/", "xmlns:udt", UDT_NS);
        document.appendChild(root);

        Element context = XmlSupport.append(root, RSM_NS, "rsm:ExchangedDocumentContext");
        Element guideline = ram(context, "GuidelineSpecifiedDocumentContextParameter");
        ram(guideline, "ID", GUIDELINE_ID);

        Element exchanged = XmlSupport.append(root, RSM_NS, "rsm:ExchangedDocument");
        ram(exchanged, "ID", message.messageId());
        ram(exchanged, "TypeCode", TYPE_CODE);
        ram(exchanged, "StatusCode", String.valueOf(message.status().getCode()));
        Element issue = ram(exchanged, "IssueDateTime");
        Element dateString = XmlSupport.append(issue, UDT_NS, "udt:DateTimeString",
            XmlSupport.formatDate102(message.issueDate()));
        dateString.setAttribute("format", "102");
        party(exchanged, "SenderTradeParty", message.sender());
        for (CdarParty recipient : message.recipients()) {
            party(exchanged, "RecipientTradeParty", recipient);
        }

        Element ack = XmlSupport.append(root, RSM_NS, "rsm:AcknowledgementDocument");
        ram(ack, "StatusCode", String.valueOf(message.status().getCode()));
        if (message.reason() != null && !message.reason().isBlank()) {
            ram(ack, "ReasonInformation", message.reason());
        }
        if (message.reasonCode() != null && !message.reasonCode().isBlank()) {
            ram(ack, "ReasonCode", message.reasonCode());
        }
        if (message.amount() != null) {
            ram(ack, "SpecifiedAmount", message.amount().toPlainString());
        }
        Element reference = ram(ack, "ReferenceReferencedDocument");
        ram(reference, "IssuerAssignedID", message.invoiceReference());

        byte[] xml = XmlSupport.toBytes(document);
        log.info("Generated CDAR message {} (status {}) for invoice {}",
            message.messageId(), message.status().getCode(), message.invoiceReference());
        return xml;
    }

    /**
     * Reads a CDAR message.
     *
     * @throws IllegalArgumentException if the XML is malformed or a mandatory element is missing
     */
    public CdarMessage parse(byte[] xml) {
        Document document;
        try {
            document = XmlSupport.parse(xml);
        } catch (SAXException | IOException e) {
            throw new IllegalArgumentException("Invalid CDAR XML: " + e.getMessage(), e);
        }
        Element root = document.getDocumentElement();

        Element exchanged = requiredChild(root, RSM_NS, "ExchangedDocument");
        String messageId = requiredText(exchanged, "ID");
        InvoiceStatus status = parseStatus(requiredText(exchanged, "StatusCode"));

        Element issue = requiredChild(exchanged, RAM_NS, "IssueDateTime");
        Element dateString = requiredChild(issue, UDT_NS, "DateTimeString");
        LocalDate issueDate;
        try {
            issueDate = LocalDate.parse(dateString.getTextContent().trim(), XmlSupport.FORMAT_102);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Invalid CDAR issue date: " + dateString.getTextContent(), e);
        }

        CdarParty sender = parseParty(requiredChild(exchanged, RAM_NS, "SenderTradeParty"));
        List<CdarParty> recipients = new ArrayList<>();
        for (Element recipient : children(exchanged, RAM_NS, "RecipientTradeParty")) {
            recipients.add(parseParty(recipient));
        }

        Element ack = requiredChild(root, RSM_NS, "AcknowledgementDocument");
        String reason = optionalText(ack, "ReasonInformation");
        String reasonCode = optionalText(ack, "ReasonCode");
        String amountText = optionalText(ack, "SpecifiedAmount");
        BigDecimal amount = amountText != null && !amountText.isEmpty() ? new BigDecimal(amountText) : null;
        Element reference = requiredChild(ack, RAM_NS, "ReferenceReferencedDocument");
        String invoiceReference = requiredText(reference, "IssuerAssignedID");

        return new CdarMessage(messageId, issueDate, status, invoiceReference, sender, recipients,
            reason, reasonCode, amount);
    }

    private InvoiceStatus parseStatus(String code) {
        try {
            return InvoiceStatus.fromCode(Integer.parseInt(code));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid CDAR status code: " + code, e);
        }
    }

    private CdarParty parseParty(Element element) {
        Element id = requiredChild(element, RAM_NS, "ID");
        return new CdarParty(
            id.getTextContent().trim(),
            id.getAttribute("schemeID"),
            PartyRole.fromCode(requiredText(element, "RoleCode"))
        );
    }

    private void party(Element parent, String tag, CdarParty party) {
        Element element = ram(parent, tag);
        Element id = ram(element, "ID", party.identifier());
        if (party.schemeId() != null) {
            id.setAttribute("schemeID", party.schemeId());
        }
        ram(element, "RoleCode", party.role().getCode());
    }

    private static List<Element> children(Element parent, String namespace, String localName) {
        List<Element> result = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE
                    && namespace.equals(node.getNamespaceURI())
                    && localName.equals(node.getLocalName())) {
                result.add((Element) node);
            }
        }
        return result;
    }

    private static Element requiredChild(Element parent, String namespace, String localName) {
        List<Element> found = children(parent, namespace, localName);
        if (found.isEmpty()) {
            throw new IllegalArgumentException("Missing mandatory CDAR element: " + localName);
        }
        return found.get(0);
    }

    private static String requiredText(Element parent, String localName) {
        String text = requiredChild(parent, RAM_NS, localName).getTextContent().trim();
        if (text.isEmpty()) {
            throw new IllegalArgumentException("Missing mandatory CDAR element: " + localName);
        }
        return text;
    }

    private static String optionalText(Element parent, String localName) {
        List<Element> found = children(parent, RAM_NS, localName);
        return found.isEmpty() ? null : found.get(0).getTextContent().trim();
    }

    private static Element ram(Element parent, String name) {
        return XmlSupport.append(parent, RAM_NS, "ram:" + name);
    }

    private static Element ram(Element parent, String name, String text) {
        return XmlSupport.append(parent, RAM_NS, "ram:" + name, text);
    }
}

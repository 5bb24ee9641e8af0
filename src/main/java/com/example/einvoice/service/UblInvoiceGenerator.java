package com.example.einvoice.service;

import com.example.einvoice.domain.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Generates OASIS UBL 2.1 XML.
 *
 * Credit notes and corrected invoices use the CreditNote root, the document
 * type carrying the sign. When a credit note totals to a negative gross, every
 * amount and quantity is negated together so that the lines still sum to the
 * header and TaxInclusiveAmount - PrepaidAmount = PayableAmount. Unit prices
 * are written as given.
 *
 * Two customisations are supported:
 * - EN16931: the European core invoice
 * - PEPPOL BIS Billing 3.0: both parties need an electronic address (SIREN,
 *   scheme 0002) and a buyer reference or purchase order reference is mandatory
 *
 * UBL is only bound from EN16931 upwards; other profiles are rejected.
 */
@Service
public class UblInvoiceGenerator extends AbstractInvoiceGenerator {

    private static final Logger log = LoggerFactory.getLogger(UblInvoiceGenerator.class);

    public static final String INVOICE_NS = "urn:oasis:names:specification:ubl:schema:xsd:Invoice-2";
    public static final String CREDIT_NOTE_NS = "urn:oasis:names:specification:ubl:schema:xsd:CreditNote-2";
    public static final String CAC_NS = "urn:oasis:names:specification:ubl:schema:xsd:CommonAggregateComponents-2";
    public static final String CBC_NS = "urn:oasis:names:specification:ubl:schema:xsd:CommonBasicComponents-2";

    private static final String SIREN_SCHEME = "0002";

    @Autowired
    public UblInvoiceGenerator(TaxCalculationService taxCalculationService,
                               @Value("${einvoice.codec.default-profile:EN16931}") String defaultProfile) {
        super(taxCalculationService, defaultProfile);
    }

    public UblInvoiceGenerator(TaxCalculationService taxCalculationService) {
        this(taxCalculationService, FacturXProfile.EN16931.name());
    }

    @Override
    public InvoiceFormat getFormat() {
        return InvoiceFormat.UBL;
    }

    @Override
    public byte[] generateXml(Invoice invoice, FacturXProfile profile) {
        return generateXml(invoice, profile, UblCustomization.EN16931);
    }

    /**
     * Generates the XML with the configured default profile and the given customisation.
     */
    public byte[] generateXml(Invoice invoice, UblCustomization customization) {
        return generateXml(invoice, defaultProfile, customization);
    }

    /**
     * Generates UBL XML.
     *
     * @param invoice The invoice
     * @param profile EN16931 or EXTENDED
     * @param customization EN16931 core or PEPPOL BIS 3.0
     * @return UTF-8 encoded XML
     * @throws InvoiceEncodingException if the profile is not bound to UBL or a required field is missing
     */
    public byte[] generateXml(Invoice invoice, FacturXProfile profile, UblCustomization customization) {
        if (profile == null || !profile.isRegulatoryCompliant()) {
            throw new InvoiceEncodingException("Unknown profile for UBL: " + profile
                + ". Available profiles: EN16931, EXTENDED");
        }
        InvoiceTotals totals = prepare(invoice, profile);
        if (customization == UblCustomization.PEPPOL_BIS_3) {
            checkPeppol(invoice);
        }

        boolean creditNote = invoice.isCreditNote();
        Document document = XmlSupport.newDocument();
        String rootNs = creditNote ? CREDIT_NOTE_NS : INVOICE_NS;
        Element root = document.createElementNS(rootNs, creditNote ? "CreditNote" : "Invoice");
        root.setAttributeNS("http://www.w3.org/2000/xmlns/", "xmlns:cac", CAC_NS);
        root.setAttributeNS("http://www.w3.org/2000/xmlns/", "xmlns:cbc", CBC_NS);
        document.appendChild(root);

        Writer writer = new Writer(invoice, totals, customization, scale(invoice), creditNote);
        writer.header(root);
        writer.references(root);
        writer.party(root, "AccountingSupplierParty", invoice.getSeller());
        writer.party(root, "AccountingCustomerParty", invoice.getBuyer());
        writer.payeeAndDelivery(root);
        writer.payment(root);
        writer.taxTotal(root);
        writer.monetaryTotal(root);
        writer.lines(root);

        byte[] xml = XmlSupport.toBytes(document);
        log.info("Generated UBL {} for invoice {} ({}): {} bytes",
            creditNote ? "CreditNote" : "Invoice", invoice.getNumber(), customization, xml.length);
        return xml;
    }

    private void checkPeppol(Invoice invoice) {
        if (!hasText(invoice.getSeller().getSiren())) {
            throw new InvoiceEncodingException("PEPPOL BIS 3.0 requires a seller electronic address (SIREN)");
        }
        if (!hasText(invoice.getBuyer().getSiren())) {
            throw new InvoiceEncodingException("PEPPOL BIS 3.0 requires a buyer electronic address (SIREN)");
        }
        if (!hasText(invoice.getBuyerReference()) && !hasText(invoice.getPurchaseOrderReference())) {
            throw new InvoiceEncodingException(
                "PEPPOL BIS 3.0 requires a buyer reference or a purchase order reference");
        }
    }

    private static final class Writer {
        private final Invoice invoice;
        private final InvoiceTotals totals;
        private final UblCustomization customization;
        private final int scale;
        private final boolean creditNote;
        private final boolean negated;

        private Writer(Invoice invoice, InvoiceTotals totals, UblCustomization customization,
                       int scale, boolean creditNote) {
            this.invoice = invoice;
            this.totals = totals;
            this.customization = customization;
            this.scale = scale;
            this.creditNote = creditNote;
            this.negated = creditNote && totals.grossTotal().signum() < 0;
        }

        private void header(Element root) {
            cbc(root, "CustomizationID", customization.getCustomizationId());
            if (customization.getProfileId() != null) {
                cbc(root, "ProfileID", customization.getProfileId());
            }
            cbc(root, "ID", invoice.getNumber());
            cbc(root, "IssueDate", invoice.getIssueDate().toString());
            if (!creditNote && invoice.getDueDate() != null) {
                cbc(root, "DueDate", invoice.getDueDate().toString());
            }
            cbc(root, creditNote ? "CreditNoteTypeCode" : "InvoiceTypeCode", invoice.getTypeCode().getCode());
            if (hasText(invoice.getNote())) {
                cbc(root, "Note", invoice.getNote());
            }
            cbc(root, "Note", "#AAI#" + invoice.getOperationCategory().getLabel());
            cbc(root, "DocumentCurrencyCode", invoice.getCurrency());
            if (hasText(invoice.getBuyerAccountingReference())) {
                cbc(root, "AccountingCost", invoice.getBuyerAccountingReference());
            }
            if (hasText(invoice.getBuyerReference())) {
                cbc(root, "BuyerReference", invoice.getBuyerReference());
            }
            if (invoice.hasBillingPeriod()) {
                period(root, invoice.getBillingPeriodStart(), invoice.getBillingPeriodEnd());
            }
        }

        private void references(Element root) {
            if (hasText(invoice.getPurchaseOrderReference())) {
                Element order = cac(root, "OrderReference");
                cbc(order, "ID", invoice.getPurchaseOrderReference());
            }
            if (hasText(invoice.getPrecedingInvoiceReference())) {
                Element billing = cac(root, "BillingReference");
                Element document = cac(billing, "InvoiceDocumentReference");
                cbc(document, "ID", invoice.getPrecedingInvoiceReference());
            }
            if (hasText(invoice.getContractReference())) {
                Element contract = cac(root, "ContractDocumentReference");
                cbc(contract, "ID", invoice.getContractReference());
            }
        }

        private void party(Element root, String tag, Party party) {
            Element wrapper = cac(root, tag);
            Element element = cac(wrapper, "Party");
            if (hasText(party.getSiren())) {
                Element endpoint = cbc(element, "EndpointID", party.getSiren());
                endpoint.setAttribute("schemeID", SIREN_SCHEME);
            }
            if (hasText(party.getSiret())) {
                Element identification = cac(element, "PartyIdentification");
                Element id = cbc(identification, "ID", party.getSiret());
                id.setAttribute("schemeID", "0009");
            }
            Element name = cac(element, "PartyName");
            cbc(name, "Name", party.getName());
            address(element, "PostalAddress", party.getAddress());
            if (hasText(party.getVatNumber())) {
                Element taxScheme = cac(element, "PartyTaxScheme");
                cbc(taxScheme, "CompanyID", party.getVatNumber());
                vatScheme(taxScheme);
            }
            Element legal = cac(element, "PartyLegalEntity");
            cbc(legal, "RegistrationName", party.getName());
            if (hasText(party.getSiren())) {
                Element companyId = cbc(legal, "CompanyID", party.getSiren());
                companyId.setAttribute("schemeID", SIREN_SCHEME);
            }
            if (hasText(party.getPhone()) || hasText(party.getEmail())) {
                Element contact = cac(element, "Contact");
                if (hasText(party.getPhone())) {
                    cbc(contact, "Telephone", party.getPhone());
                }
                if (hasText(party.getEmail())) {
                    cbc(contact, "ElectronicMail", party.getEmail());
                }
            }
        }

        private void address(Element parent, String tag, Address address) {
            Element element = cac(parent, tag);
            cbc(element, "StreetName", address.street());
            if (hasText(address.additionalStreet())) {
                cbc(element, "AdditionalStreetName", address.additionalStreet());
            }
            cbc(element, "CityName", address.city());
            cbc(element, "PostalZone", address.postalCode());
            if (hasText(address.subdivision())) {
                cbc(element, "CountrySubentity", address.subdivision());
            }
            Element country = cac(element, "Country");
            cbc(country, "IdentificationCode", address.countryCode());
        }

        private void payeeAndDelivery(Element root) {
            Party payee = invoice.getPayee();
            if (payee != null) {
                Element element = cac(root, "PayeeParty");
                if (hasText(payee.getSiren())) {
                    Element identification = cac(element, "PartyIdentification");
                    Element id = cbc(identification, "ID", payee.getSiren());
                    id.setAttribute("schemeID", SIREN_SCHEME);
                }
                Element name = cac(element, "PartyName");
                cbc(name, "Name", payee.getName());
            }
            Address shipTo = invoice.getBuyer().getDeliveryAddress();
            if (shipTo != null) {
                Element delivery = cac(root, "Delivery");
                Element location = cac(delivery, "DeliveryLocation");
                address(location, "Address", shipTo);
            }
        }

        private void payment(Element root) {
            PaymentMeans means = invoice.getPaymentMeans();
            if (means != null) {
                Element element = cac(root, "PaymentMeans");
                cbc(element, "PaymentMeansCode", means.code().getCode());
                if (creditNote && invoice.getDueDate() != null) {
                    cbc(element, "PaymentDueDate", invoice.getDueDate().toString());
                }
                if (hasText(means.paymentReference())) {
                    cbc(element, "PaymentID", means.paymentReference());
                }
                BankAccount account = means.bankAccount();
                if (account != null) {
                    Element financial = cac(element, "PayeeFinancialAccount");
                    cbc(financial, "ID", account.iban());
                    if (hasText(account.bic())) {
                        Element branch = cac(financial, "FinancialInstitutionBranch");
                        cbc(branch, "ID", account.bic());
                    }
                }
            }
            PaymentTerms terms = invoice.getPaymentTerms();
            if (terms != null && hasText(terms.description())) {
                Element element = cac(root, "PaymentTerms");
                cbc(element, "Note", terms.description());
            }
        }

        private void taxTotal(Element root) {
            Element taxTotal = cac(root, "TaxTotal");
            money(taxTotal, "TaxAmount", totals.taxTotal());
            for (TaxSummary summary : totals.taxSummaries()) {
                Element subtotal = cac(taxTotal, "TaxSubtotal");
                money(subtotal, "TaxableAmount", summary.taxableAmount());
                money(subtotal, "TaxAmount", summary.taxAmount());
                Element category = cac(subtotal, "TaxCategory");
                cbc(category, "ID", summary.category().getCode());
                cbc(category, "Percent", XmlSupport.formatRate(summary.rate()));
                if (hasText(summary.exemptionReasonCode())) {
                    cbc(category, "TaxExemptionReasonCode", summary.exemptionReasonCode());
                }
                if (hasText(summary.exemptionReason())) {
                    cbc(category, "TaxExemptionReason", summary.exemptionReason());
                }
                vatScheme(category);
            }
        }

        private void monetaryTotal(Element root) {
            Element total = cac(root, "LegalMonetaryTotal");
            money(total, "LineExtensionAmount", totals.netTotal());
            money(total, "TaxExclusiveAmount", totals.netTotal());
            money(total, "TaxInclusiveAmount", totals.grossTotal());
            if (totals.prepaidAmount().signum() != 0) {
                money(total, "PrepaidAmount", totals.prepaidAmount());
            }
            money(total, "PayableAmount", totals.amountDue());
        }

        private void lines(Element root) {
            List<InvoiceLine> lines = invoice.getLines();
            for (int i = 0; i < lines.size(); i++) {
                InvoiceLine line = lines.get(i);
                Element element = cac(root, creditNote ? "CreditNoteLine" : "InvoiceLine");
                cbc(element, "ID", line.getLineNumber() != null
                    ? String.valueOf(line.getLineNumber())
                    : String.valueOf(i + 1));
                Element quantity = cbc(element, creditNote ? "CreditedQuantity" : "InvoicedQuantity",
                    XmlSupport.formatQuantity(signed(line.getQuantity())));
                quantity.setAttribute("unitCode", line.getUnit().getCode());
                money(element, "LineExtensionAmount", line.getNetAmount());
                if (line.hasBillingPeriod()) {
                    period(element, line.getBillingPeriodStart(), line.getBillingPeriodEnd());
                }
                if (line.getDiscountAmount() != null && line.getDiscountAmount().signum() > 0) {
                    allowanceCharge(element, false, line.getDiscountAmount());
                }
                if (line.getChargeAmount() != null && line.getChargeAmount().signum() > 0) {
                    allowanceCharge(element, true, line.getChargeAmount());
                }

                Element item = cac(element, "Item");
                cbc(item, "Name", line.getDescription());
                if (hasText(line.getBuyerItemReference())) {
                    Element buyers = cac(item, "BuyersItemIdentification");
                    cbc(buyers, "ID", line.getBuyerItemReference());
                }
                if (hasText(line.getSellerItemReference())) {
                    Element sellers = cac(item, "SellersItemIdentification");
                    cbc(sellers, "ID", line.getSellerItemReference());
                }
                Element category = cac(item, "ClassifiedTaxCategory");
                cbc(category, "ID", line.getVatCategory().getCode());
                cbc(category, "Percent", XmlSupport.formatRate(line.getVatRate()));
                vatScheme(category);

                Element price = cac(element, "Price");
                Element priceAmount = cbc(price, "PriceAmount", line.getUnitPrice().toPlainString());
                priceAmount.setAttribute("currencyID", invoice.getCurrency());
            }
        }

        private void allowanceCharge(Element parent, boolean charge, BigDecimal amount) {
            Element element = cac(parent, "AllowanceCharge");
            cbc(element, "ChargeIndicator", String.valueOf(charge));
            money(element, "Amount", amount);
        }

        private void period(Element parent, LocalDate start, LocalDate end) {
            Element period = cac(parent, "InvoicePeriod");
            if (start != null) {
                cbc(period, "StartDate", start.toString());
            }
            if (end != null) {
                cbc(period, "EndDate", end.toString());
            }
        }

        private void vatScheme(Element parent) {
            Element scheme = cac(parent, "TaxScheme");
            cbc(scheme, "ID", "VAT");
        }

        private void money(Element parent, String tag, BigDecimal value) {
            Element element = cbc(parent, tag, XmlSupport.formatAmount(signed(value), scale));
            element.setAttribute("currencyID", invoice.getCurrency());
        }

        private BigDecimal signed(BigDecimal value) {
            return negated ? value.negate() : value;
        }

        private static Element cac(Element parent, String name) {
            return XmlSupport.append(parent, CAC_NS, "cac:" + name);
        }

        private static Element cbc(Element parent, String name, String text) {
            return XmlSupport.append(parent, CBC_NS, "cbc:" + name, text);
        }
    }
}

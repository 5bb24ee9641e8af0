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
 * Generates UN/CEFACT Cross Industry Invoice (CII D16B) XML, the syntax
 * embedded in Factur-X documents.
 *
 * Element order follows the xs:sequence of the CII schema. What is written
 * depends on the profile:
 * - MINIMUM: header, parties, document totals
 * - BASIC_WL: adds notes, VAT breakdown, payment data and references to other invoices
 * - BASIC: adds the invoice lines
 * - EN16931: adds item references, line periods, exemption reasons,
 *   order and contract references and the payee
 * - EXTENDED: adds informative sub-lines
 *
 * A profile below EN16931 is produced as requested and logged as incomplete,
 * never upgraded.
 */
@Service
public class CiiInvoiceGenerator extends AbstractInvoiceGenerator {

    private static final Logger log = LoggerFactory.getLogger(CiiInvoiceGenerator.class);

    public static final String RSM_NS = "urn:un:unece:uncefact:data:standard:CrossIndustryInvoice:100";
    public static final String RAM_NS = "urn:un:unece:uncefact:data:standard:ReusableAggregateBusinessInformationEntity:100";
    public static final String QDT_NS = "urn:un:unece:uncefact:data:standard:QualifiedDataType:100";
    public static final String UDT_NS = "urn:un:unece:uncefact:data:standard:UnqualifiedDataType:100";

    static final String SIREN_SCHEME = "0002";
    private static final String SUB_LINE_STATUS = "INFORMATION";

    @Autowired
    public CiiInvoiceGenerator(TaxCalculationService taxCalculationService,
                               @Value("${einvoice.codec.default-profile:EN16931}") String defaultProfile) {
        super(taxCalculationService, defaultProfile);
    }

    public CiiInvoiceGenerator(TaxCalculationService taxCalculationService) {
        this(taxCalculationService, FacturXProfile.EN16931.name());
    }

    @Override
    public InvoiceFormat getFormat() {
        return InvoiceFormat.CII;
    }

    @Override
    public byte[] generateXml(Invoice invoice, FacturXProfile profile) {
        InvoiceTotals totals = prepare(invoice, profile);

        Document document = XmlSupport.newDocument();
        Element root = document.createElementNS(RSM_NS, "rsm:CrossIndustryInvoice");
        root.setAttributeNS("http://www.w3.org/2000/xmlns/", "xmlns:qdt", QDT_NS);
        root.setAttributeNS("http://www.w3.org/2000/xmlns/", "xmlns:ram", RAM_NS);
        root.setAttributeNS("http://www.w3.org/2000/xmlns/", "xmlns:rsm", RSM_NS);
        root.setAttributeNS("http://www.w3.org/2000/xmlns/", "xmlns:udt", UDT_NS);
        document.appendChild(root);

        Writer writer = new Writer(invoice, totals, profile, scale(invoice));
        writer.context(root);
        writer.exchangedDocument(root);
        writer.transaction(root);

        byte[] xml = XmlSupport.toBytes(document);
        log.info("Generated CII XML for invoice {} with profile {}: {} bytes", invoice.getNumber(), profile, xml.length);
        return xml;
    }

    /**
     * Writes one document; holds the per-invoice state so the generator stays stateless.
     */
    private static final class Writer {
        private final Invoice invoice;
        private final InvoiceTotals totals;
        private final FacturXProfile profile;
        private final int scale;

        private Writer(Invoice invoice, InvoiceTotals totals, FacturXProfile profile, int scale) {
            this.invoice = invoice;
            this.totals = totals;
            this.profile = profile;
            this.scale = scale;
        }

        private void context(Element root) {
            Element context = rsm(root, "ExchangedDocumentContext");
            Element guideline = ram(context, "GuidelineSpecifiedDocumentContextParameter");
            ram(guideline, "ID", profile.getGuidelineId());
        }

        private void exchangedDocument(Element root) {
            Element doc = rsm(root, "ExchangedDocument");
            ram(doc, "ID", invoice.getNumber());
            ram(doc, "TypeCode", invoice.getTypeCode().getCode());
            dateTime(doc, "IssueDateTime", invoice.getIssueDate());

            if (!profile.isAtLeast(FacturXProfile.BASIC_WL)) {
                return;
            }
            if (hasText(invoice.getNote())) {
                note(doc, invoice.getNote(), null);
            }
            note(doc, invoice.getOperationCategory().getLabel(), "AAI");

            PaymentTerms terms = invoice.getPaymentTerms();
            if (terms != null) {
                if (terms.latePenaltyRate() != null) {
                    note(doc, "Pénalités de retard : " + XmlSupport.formatRate(terms.latePenaltyRate())
                        + " % par an", "PMD");
                }
                note(doc, "Indemnité forfaitaire pour frais de recouvrement : "
                    + XmlSupport.formatAmount(terms.recoveryFee(), 2) + " EUR", "PMT");
                if (hasText(terms.earlyDiscount())) {
                    note(doc, terms.earlyDiscount(), "AAB");
                }
            }
        }

        private void note(Element doc, String content, String subjectCode) {
            Element note = ram(doc, "IncludedNote");
            ram(note, "Content", content);
            if (subjectCode != null) {
                ram(note, "SubjectCode", subjectCode);
            }
        }

        private void transaction(Element root) {
            Element transaction = rsm(root, "SupplyChainTradeTransaction");

            if (profile.isAtLeast(FacturXProfile.BASIC)) {
                List<InvoiceLine> lines = invoice.getLines();
                for (int i = 0; i < lines.size(); i++) {
                    InvoiceLine line = lines.get(i);
                    String lineId = line.getLineNumber() != null
                        ? String.valueOf(line.getLineNumber())
                        : String.valueOf(i + 1);
                    lineItem(transaction, line, lineId, null);

                    if (profile.isAtLeast(FacturXProfile.EXTENDED)) {
                        List<InvoiceLine> subLines = line.getSubLines();
                        for (int j = 0; j < subLines.size(); j++) {
                            lineItem(transaction, subLines.get(j), lineId + "." + (j + 1), lineId);
                        }
                    }
                }
            }

            headerAgreement(transaction);
            headerDelivery(transaction);
            headerSettlement(transaction);
        }

        private void lineItem(Element transaction, InvoiceLine line, String lineId, String parentLineId) {
            boolean detailed = profile.isAtLeast(FacturXProfile.EN16931);
            Element item = ram(transaction, "IncludedSupplyChainTradeLineItem");

            Element lineDoc = ram(item, "AssociatedDocumentLineDocument");
            ram(lineDoc, "LineID", lineId);
            if (parentLineId != null) {
                ram(lineDoc, "ParentLineID", parentLineId);
                ram(lineDoc, "LineStatusReasonCode", SUB_LINE_STATUS);
            }

            Element product = ram(item, "SpecifiedTradeProduct");
            if (detailed && hasText(line.getSellerItemReference())) {
                ram(product, "SellerAssignedID", line.getSellerItemReference());
            }
            if (detailed && hasText(line.getBuyerItemReference())) {
                ram(product, "BuyerAssignedID", line.getBuyerItemReference());
            }
            ram(product, "Name", line.getDescription());

            Element agreement = ram(item, "SpecifiedLineTradeAgreement");
            Element netPrice = ram(agreement, "NetPriceProductTradePrice");
            ram(netPrice, "ChargeAmount", line.getUnitPrice().toPlainString());

            Element delivery = ram(item, "SpecifiedLineTradeDelivery");
            Element quantity = ram(delivery, "BilledQuantity", XmlSupport.formatQuantity(line.getQuantity()));
            quantity.setAttribute("unitCode", line.getUnit().getCode());

            Element settlement = ram(item, "SpecifiedLineTradeSettlement");
            Element tax = ram(settlement, "ApplicableTradeTax");
            ram(tax, "TypeCode", "VAT");
            if (detailed && hasText(line.getExemptionReason())) {
                ram(tax, "ExemptionReason", line.getExemptionReason());
            }
            ram(tax, "CategoryCode", line.getVatCategory().getCode());
            if (detailed && hasText(line.getExemptionReasonCode())) {
                ram(tax, "ExemptionReasonCode", line.getExemptionReasonCode());
            }
            ram(tax, "RateApplicablePercent", XmlSupport.formatRate(line.getVatRate()));

            if (detailed && line.hasBillingPeriod()) {
                period(settlement, line.getBillingPeriodStart(), line.getBillingPeriodEnd());
            }
            if (line.getDiscountAmount() != null && line.getDiscountAmount().signum() > 0) {
                allowanceCharge(settlement, false, line.getDiscountAmount());
            }
            if (line.getChargeAmount() != null && line.getChargeAmount().signum() > 0) {
                allowanceCharge(settlement, true, line.getChargeAmount());
            }

            Element summation = ram(settlement, "SpecifiedTradeSettlementLineMonetarySummation");
            ram(summation, "LineTotalAmount", amount(line.getNetAmount()));
        }

        private void allowanceCharge(Element settlement, boolean charge, BigDecimal value) {
            Element allowanceCharge = ram(settlement, "SpecifiedTradeAllowanceCharge");
            Element indicator = ram(allowanceCharge, "ChargeIndicator");
            udt(indicator, "Indicator", String.valueOf(charge));
            ram(allowanceCharge, "ActualAmount", amount(value));
        }

        private void headerAgreement(Element transaction) {
            Element agreement = ram(transaction, "ApplicableHeaderTradeAgreement");
            if (hasText(invoice.getBuyerReference())) {
                ram(agreement, "BuyerReference", invoice.getBuyerReference());
            }
            tradeParty(agreement, "SellerTradeParty", invoice.getSeller(), true);
            tradeParty(agreement, "BuyerTradeParty", invoice.getBuyer(), false);

            if (profile.isAtLeast(FacturXProfile.EN16931)) {
                if (hasText(invoice.getPurchaseOrderReference())) {
                    Element order = ram(agreement, "BuyerOrderReferencedDocument");
                    ram(order, "IssuerAssignedID", invoice.getPurchaseOrderReference());
                }
                if (hasText(invoice.getContractReference())) {
                    Element contract = ram(agreement, "ContractReferencedDocument");
                    ram(contract, "IssuerAssignedID", invoice.getContractReference());
                }
            }
        }

        private void tradeParty(Element parent, String tag, Party party, boolean seller) {
            boolean minimal = !profile.isAtLeast(FacturXProfile.BASIC_WL);
            Element element = ram(parent, tag);
            ram(element, "Name", party.getName());
            if (hasText(party.getSiren())) {
                Element legal = ram(element, "SpecifiedLegalOrganization");
                Element id = ram(legal, "ID", party.getSiren());
                id.setAttribute("schemeID", SIREN_SCHEME);
            }
            if (minimal) {
                // MINIMUM carries the seller country only
                if (seller) {
                    Element address = ram(element, "PostalTradeAddress");
                    ram(address, "CountryID", party.getAddress().countryCode());
                }
            } else {
                address(element, party.getAddress());
                if (hasText(party.getEmail())) {
                    Element uri = ram(element, "URIUniversalCommunication");
                    Element uriId = ram(uri, "URIID", party.getEmail());
                    uriId.setAttribute("schemeID", "EM");
                }
            }
            if (hasText(party.getVatNumber()) && (seller || !minimal)) {
                Element registration = ram(element, "SpecifiedTaxRegistration");
                Element id = ram(registration, "ID", party.getVatNumber());
                id.setAttribute("schemeID", "VA");
            }
        }

        private void address(Element parent, Address address) {
            Element element = ram(parent, "PostalTradeAddress");
            ram(element, "PostcodeCode", address.postalCode());
            ram(element, "LineOne", address.street());
            if (hasText(address.additionalStreet())) {
                ram(element, "LineTwo", address.additionalStreet());
            }
            ram(element, "CityName", address.city());
            ram(element, "CountryID", address.countryCode());
            if (hasText(address.subdivision())) {
                ram(element, "CountrySubDivisionName", address.subdivision());
            }
        }

        private void headerDelivery(Element transaction) {
            Element delivery = ram(transaction, "ApplicableHeaderTradeDelivery");
            Address shipTo = invoice.getBuyer().getDeliveryAddress();
            if (shipTo != null && profile.isAtLeast(FacturXProfile.BASIC_WL)) {
                Element party = ram(delivery, "ShipToTradeParty");
                address(party, shipTo);
            }
        }

        private void headerSettlement(Element transaction) {
            boolean withBreakdown = profile.isAtLeast(FacturXProfile.BASIC_WL);
            Element settlement = ram(transaction, "ApplicableHeaderTradeSettlement");
            PaymentMeans means = invoice.getPaymentMeans();

            if (withBreakdown && means != null && hasText(means.paymentReference())) {
                ram(settlement, "PaymentReference", means.paymentReference());
            }
            ram(settlement, "InvoiceCurrencyCode", invoice.getCurrency());

            if (invoice.getPayee() != null && profile.isAtLeast(FacturXProfile.EN16931)) {
                Element payee = ram(settlement, "PayeeTradeParty");
                ram(payee, "Name", invoice.getPayee().getName());
                if (hasText(invoice.getPayee().getSiren())) {
                    Element legal = ram(payee, "SpecifiedLegalOrganization");
                    Element id = ram(legal, "ID", invoice.getPayee().getSiren());
                    id.setAttribute("schemeID", SIREN_SCHEME);
                }
            }

            if (withBreakdown) {
                if (means != null) {
                    paymentMeans(settlement, means);
                }
                for (TaxSummary summary : totals.taxSummaries()) {
                    taxSummary(settlement, summary);
                }
                if (invoice.hasBillingPeriod()) {
                    period(settlement, invoice.getBillingPeriodStart(), invoice.getBillingPeriodEnd());
                }
                if (invoice.getPaymentTerms() != null || invoice.getDueDate() != null) {
                    paymentTerms(settlement);
                }
            }

            monetarySummation(settlement, withBreakdown);

            if (withBreakdown && hasText(invoice.getPrecedingInvoiceReference())) {
                Element reference = ram(settlement, "InvoiceReferencedDocument");
                ram(reference, "IssuerAssignedID", invoice.getPrecedingInvoiceReference());
            }
            if (withBreakdown && hasText(invoice.getBuyerAccountingReference())) {
                Element account = ram(settlement, "ReceivableSpecifiedTradeAccountingAccount");
                ram(account, "ID", invoice.getBuyerAccountingReference());
            }
        }

        private void paymentMeans(Element settlement, PaymentMeans means) {
            Element element = ram(settlement, "SpecifiedTradeSettlementPaymentMeans");
            ram(element, "TypeCode", means.code().getCode());
            BankAccount account = means.bankAccount();
            if (account != null) {
                Element creditor = ram(element, "PayeePartyCreditorFinancialAccount");
                ram(creditor, "IBANID", account.iban());
                if (hasText(account.bic()) && profile.isAtLeast(FacturXProfile.EN16931)) {
                    Element institution = ram(element, "PayeeSpecifiedCreditorFinancialInstitution");
                    ram(institution, "BICID", account.bic());
                }
            }
        }

        private void taxSummary(Element settlement, TaxSummary summary) {
            Element tax = ram(settlement, "ApplicableTradeTax");
            ram(tax, "CalculatedAmount", amount(summary.taxAmount()));
            ram(tax, "TypeCode", "VAT");
            if (hasText(summary.exemptionReason())) {
                ram(tax, "ExemptionReason", summary.exemptionReason());
            }
            ram(tax, "BasisAmount", amount(summary.taxableAmount()));
            ram(tax, "CategoryCode", summary.category().getCode());
            if (hasText(summary.exemptionReasonCode())) {
                ram(tax, "ExemptionReasonCode", summary.exemptionReasonCode());
            }
            if (invoice.isVatOnDebits()) {
                // VAT due on invoicing date
                ram(tax, "DueDateTypeCode", "5");
            }
            ram(tax, "RateApplicablePercent", XmlSupport.formatRate(summary.rate()));
        }

        private void paymentTerms(Element settlement) {
            Element terms = ram(settlement, "SpecifiedTradePaymentTerms");
            PaymentTerms paymentTerms = invoice.getPaymentTerms();
            if (paymentTerms != null && hasText(paymentTerms.description())) {
                ram(terms, "Description", paymentTerms.description());
            }
            if (invoice.getDueDate() != null) {
                dateTime(terms, "DueDateDateTime", invoice.getDueDate());
            }
        }

        private void monetarySummation(Element settlement, boolean full) {
            Element summation = ram(settlement, "SpecifiedTradeSettlementHeaderMonetarySummation");
            if (full) {
                ram(summation, "LineTotalAmount", amount(totals.netTotal()));
            }
            ram(summation, "TaxBasisTotalAmount", amount(totals.netTotal()));
            Element taxTotal = ram(summation, "TaxTotalAmount", amount(totals.taxTotal()));
            taxTotal.setAttribute("currencyID", invoice.getCurrency());
            ram(summation, "GrandTotalAmount", amount(totals.grossTotal()));
            if (full && totals.prepaidAmount().signum() != 0) {
                ram(summation, "TotalPrepaidAmount", amount(totals.prepaidAmount()));
            }
            ram(summation, "DuePayableAmount", amount(totals.amountDue()));
        }

        private void period(Element parent, LocalDate start, LocalDate end) {
            Element period = ram(parent, "BillingSpecifiedPeriod");
            if (start != null) {
                dateTime(period, "StartDateTime", start);
            }
            if (end != null) {
                dateTime(period, "EndDateTime", end);
            }
        }

        private void dateTime(Element parent, String tag, LocalDate date) {
            Element dateTime = ram(parent, tag);
            Element value = udt(dateTime, "DateTimeString", XmlSupport.formatDate102(date));
            value.setAttribute("format", "102");
        }

        private String amount(BigDecimal value) {
            return XmlSupport.formatAmount(value, scale);
        }

        private static Element rsm(Element parent, String name) {
            return XmlSupport.append(parent, RSM_NS, "rsm:" + name);
        }

        private static Element ram(Element parent, String name) {
            return XmlSupport.append(parent, RAM_NS, "ram:" + name);
        }

        private static Element ram(Element parent, String name, String text) {
            return XmlSupport.append(parent, RAM_NS, "ram:" + name, text);
        }

        private static Element udt(Element parent, String name, String text) {
            return XmlSupport.append(parent, UDT_NS, "udt:" + name, text);
        }
    }
}

package com.example.einvoice.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Canonical invoice shared by every output format.
 *
 * Immutable once built. Holds no totals: net, VAT, gross and amount due are
 * derived from the lines by {@link com.example.einvoice.service.TaxCalculationService}
 * each time they are needed, so they cannot drift from the line data.
 *
 * The preceding-invoice reference required by credit notes and corrected
 * invoices is enforced when the document is encoded, not here.
 */
public final class Invoice {

    public static final String DEFAULT_CURRENCY = "EUR";

    private final String number;
    private final LocalDate issueDate;
    private final LocalDate dueDate;
    private final InvoiceTypeCode typeCode;
    private final String currency;
    private final OperationCategory operationCategory;
    private final boolean vatOnDebits;
    private final Party seller;
    private final Party buyer;
    private final Party payee;
    private final List<InvoiceLine> lines;
    private final String purchaseOrderReference;
    private final String contractReference;
    private final String precedingInvoiceReference;
    private final String buyerAccountingReference;
    private final String buyerReference;
    private final PaymentTerms paymentTerms;
    private final PaymentMeans paymentMeans;
    private final BigDecimal prepaidAmount;
    private final LocalDate billingPeriodStart;
    private final LocalDate billingPeriodEnd;
    private final String note;

    private Invoice(Builder builder) {
        if (builder.number == null || builder.number.isBlank()) {
            throw new IllegalArgumentException("Invoice number is required");
        }
        if (builder.issueDate == null) {
            throw new IllegalArgumentException("Issue date is required for invoice " + builder.number);
        }
        if (builder.currency == null || !builder.currency.matches("[A-Z]{3}")) {
            throw new IllegalArgumentException("Invalid ISO 4217 currency code: " + builder.currency);
        }
        if (builder.operationCategory == null) {
            throw new IllegalArgumentException("Operation category is mandatory for invoice " + builder.number);
        }
        if (builder.seller == null || builder.buyer == null) {
            throw new IllegalArgumentException("Seller and buyer are required for invoice " + builder.number);
        }
        if (builder.lines.isEmpty()) {
            throw new IllegalArgumentException("Invoice " + builder.number + " must contain at least one line");
        }
        if (builder.prepaidAmount != null && builder.prepaidAmount.signum() < 0) {
            throw new IllegalArgumentException("Prepaid amount cannot be negative");
        }
        if (builder.billingPeriodStart != null && builder.billingPeriodEnd != null
                && builder.billingPeriodStart.isAfter(builder.billingPeriodEnd)) {
            throw new IllegalArgumentException("Billing period starts after it ends");
        }
        this.number = builder.number;
        this.issueDate = builder.issueDate;
        this.dueDate = builder.dueDate;
        this.typeCode = builder.typeCode;
        this.currency = builder.currency;
        this.operationCategory = builder.operationCategory;
        this.vatOnDebits = builder.vatOnDebits;
        this.seller = builder.seller;
        this.buyer = builder.buyer;
        this.payee = builder.payee;
        this.lines = List.copyOf(builder.lines);
        this.purchaseOrderReference = builder.purchaseOrderReference;
        this.contractReference = builder.contractReference;
        this.precedingInvoiceReference = builder.precedingInvoiceReference;
        this.buyerAccountingReference = builder.buyerAccountingReference;
        this.buyerReference = builder.buyerReference;
        this.paymentTerms = builder.paymentTerms;
        this.paymentMeans = builder.paymentMeans;
        this.prepaidAmount = builder.prepaidAmount;
        this.billingPeriodStart = builder.billingPeriodStart;
        this.billingPeriodEnd = builder.billingPeriodEnd;
        this.note = builder.note;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isCreditNote() {
        return typeCode.isCreditNote();
    }

    public boolean hasBillingPeriod() {
        return billingPeriodStart != null || billingPeriodEnd != null;
    }

    public String getNumber() {
        return number;
    }

    public LocalDate getIssueDate() {
        return issueDate;
    }

    public LocalDate getDueDate() {
        return dueDate;
    }

    public InvoiceTypeCode getTypeCode() {
        return typeCode;
    }

    public String getCurrency() {
        return currency;
    }

    public OperationCategory getOperationCategory() {
        return operationCategory;
    }

    public boolean isVatOnDebits() {
        return vatOnDebits;
    }

    public Party getSeller() {
        return seller;
    }

    public Party getBuyer() {
        return buyer;
    }

    public Party getPayee() {
        return payee;
    }

    public List<InvoiceLine> getLines() {
        return lines;
    }

    public String getPurchaseOrderReference() {
        return purchaseOrderReference;
    }

    public String getContractReference() {
        return contractReference;
    }

    public String getPrecedingInvoiceReference() {
        return precedingInvoiceReference;
    }

    public String getBuyerAccountingReference() {
        return buyerAccountingReference;
    }

    public String getBuyerReference() {
        return buyerReference;
    }

    public PaymentTerms getPaymentTerms() {
        return paymentTerms;
    }

    public PaymentMeans getPaymentMeans() {
        return paymentMeans;
    }

    public BigDecimal getPrepaidAmount() {
        return prepaidAmount;
    }

    public LocalDate getBillingPeriodStart() {
        return billingPeriodStart;
    }

    public LocalDate getBillingPeriodEnd() {
        return billingPeriodEnd;
    }

    public String getNote() {
        return note;
    }

    @Override
    public String toString() {
        return typeCode.getCode() + " " + number;
    }

    public static final class Builder {
        private String number;
        private LocalDate issueDate;
        private LocalDate dueDate;
        private InvoiceTypeCode typeCode = InvoiceTypeCode.INVOICE;
        private String currency = DEFAULT_CURRENCY;
        private OperationCategory operationCategory;
        private boolean vatOnDebits;
        private Party seller;
        private Party buyer;
        private Party payee;
        private final List<InvoiceLine> lines = new ArrayList<>();
        private String purchaseOrderReference;
        private String contractReference;
        private String precedingInvoiceReference;
        private String buyerAccountingReference;
        private String buyerReference;
        private PaymentTerms paymentTerms;
        private PaymentMeans paymentMeans;
        private BigDecimal prepaidAmount;
        private LocalDate billingPeriodStart;
        private LocalDate billingPeriodEnd;
        private String note;

        private Builder() {
        }

        public Builder number(String number) {
            this.number = number;
            return this;
        }

        public Builder issueDate(LocalDate issueDate) {
            this.issueDate = issueDate;
            return this;
        }

        public Builder dueDate(LocalDate dueDate) {
            this.dueDate = dueDate;
            return this;
        }

        public Builder typeCode(InvoiceTypeCode typeCode) {
            this.typeCode = typeCode != null ? typeCode : InvoiceTypeCode.INVOICE;
            return this;
        }

        public Builder currency(String currency) {
            this.currency = currency;
            return this;
        }

        public Builder operationCategory(OperationCategory operationCategory) {
            this.operationCategory = operationCategory;
            return this;
        }

        public Builder vatOnDebits(boolean vatOnDebits) {
            this.vatOnDebits = vatOnDebits;
            return this;
        }

        public Builder seller(Party seller) {
            this.seller = seller;
            return this;
        }

        public Builder buyer(Party buyer) {
            this.buyer = buyer;
            return this;
        }

        public Builder payee(Party payee) {
            this.payee = payee;
            return this;
        }

        public Builder addLine(InvoiceLine line) {
            this.lines.add(line);
            return this;
        }

        public Builder lines(List<InvoiceLine> lines) {
            this.lines.clear();
            this.lines.addAll(lines);
            return this;
        }

        public Builder purchaseOrderReference(String purchaseOrderReference) {
            this.purchaseOrderReference = purchaseOrderReference;
            return this;
        }

        public Builder contractReference(String contractReference) {
            this.contractReference = contractReference;
            return this;
        }

        public Builder precedingInvoiceReference(String precedingInvoiceReference) {
            this.precedingInvoiceReference = precedingInvoiceReference;
            return this;
        }

        public Builder buyerAccountingReference(String buyerAccountingReference) {
            this.buyerAccountingReference = buyerAccountingReference;
            return this;
        }

        public Builder buyerReference(String buyerReference) {
            this.buyerReference = buyerReference;
            return this;
        }

        public Builder paymentTerms(PaymentTerms paymentTerms) {
            this.paymentTerms = paymentTerms;
            return this;
        }

        public Builder paymentMeans(PaymentMeans paymentMeans) {
            this.paymentMeans = paymentMeans;
            return this;
        }

        public Builder prepaidAmount(BigDecimal prepaidAmount) {
            this.prepaidAmount = prepaidAmount;
            return this;
        }

        public Builder billingPeriod(LocalDate start, LocalDate end) {
            this.billingPeriodStart = start;
            this.billingPeriodEnd = end;
            return this;
        }

        public Builder note(String note) {
            this.note = note;
            return this;
        }

        public Invoice build() {
            return new Invoice(this);
        }
    }
}

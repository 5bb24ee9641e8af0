package com.example.einvoice.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A single e-reported transaction (B2C sale or international B2B operation).
 *
 * Either an invoice date or a period identifies when the operation happened.
 * Field consistency (SIREN, dates, VAT rate, country) is checked by
 * {@link com.example.einvoice.service.EReporter}, not at construction.
 */
public final class EReportingTransaction {

    private final String transactionId;
    private final String sellerSiren;
    private final EReportingTransactionType transactionType;
    private final LocalDate periodStart;
    private final LocalDate periodEnd;
    private final LocalDate invoiceDate;
    private final String invoiceNumber;
    private final OperationCategory operationCategory;
    private final BigDecimal totalExclTax;
    private final BigDecimal vatAmount;
    private final BigDecimal vatRate;
    private final boolean vatExemption;
    private final BigDecimal taxDueInFrance;
    private final boolean vatOnDebits;
    private final String countryCode;
    private final String currency;

    private EReportingTransaction(Builder builder) {
        if (builder.transactionType == null) {
            throw new IllegalArgumentException("Transaction type is required");
        }
        if (builder.operationCategory == null) {
            throw new IllegalArgumentException("Operation category is required");
        }
        if (builder.totalExclTax == null) {
            throw new IllegalArgumentException("Total excluding tax is required");
        }
        if (builder.vatRate != null && builder.vatRate.signum() < 0) {
            throw new IllegalArgumentException("VAT rate cannot be negative");
        }
        this.transactionId = builder.transactionId != null ? builder.transactionId : UUID.randomUUID().toString();
        this.sellerSiren = builder.sellerSiren;
        this.transactionType = builder.transactionType;
        this.periodStart = builder.periodStart;
        this.periodEnd = builder.periodEnd;
        this.invoiceDate = builder.invoiceDate;
        this.invoiceNumber = builder.invoiceNumber;
        this.operationCategory = builder.operationCategory;
        this.totalExclTax = builder.totalExclTax;
        this.vatAmount = builder.vatAmount;
        this.vatRate = builder.vatRate;
        this.vatExemption = builder.vatExemption;
        this.taxDueInFrance = builder.taxDueInFrance;
        this.vatOnDebits = builder.vatOnDebits;
        this.countryCode = builder.countryCode;
        this.currency = builder.currency;
    }

    public static Builder builder() {
        return new Builder();
    }

    public BigDecimal getTotalInclTax() {
        return totalExclTax.add(vatAmount);
    }

    /** Date used to place the transaction in a reporting period. */
    public LocalDate getReferenceDate() {
        return invoiceDate != null ? invoiceDate : periodStart;
    }

    public String getTransactionId() {
        return transactionId;
    }

    public String getSellerSiren() {
        return sellerSiren;
    }

    public EReportingTransactionType getTransactionType() {
        return transactionType;
    }

    public LocalDate getPeriodStart() {
        return periodStart;
    }

    public LocalDate getPeriodEnd() {
        return periodEnd;
    }

    public LocalDate getInvoiceDate() {
        return invoiceDate;
    }

    public String getInvoiceNumber() {
        return invoiceNumber;
    }

    public OperationCategory getOperationCategory() {
        return operationCategory;
    }

    public BigDecimal getTotalExclTax() {
        return totalExclTax;
    }

    public BigDecimal getVatAmount() {
        return vatAmount;
    }

    public BigDecimal getVatRate() {
        return vatRate;
    }

    public boolean isVatExemption() {
        return vatExemption;
    }

    public BigDecimal getTaxDueInFrance() {
        return taxDueInFrance;
    }

    public boolean isVatOnDebits() {
        return vatOnDebits;
    }

    public String getCountryCode() {
        return countryCode;
    }

    public String getCurrency() {
        return currency;
    }

    public static final class Builder {
        private String transactionId;
        private String sellerSiren;
        private EReportingTransactionType transactionType;
        private LocalDate periodStart;
        private LocalDate periodEnd;
        private LocalDate invoiceDate;
        private String invoiceNumber;
        private OperationCategory operationCategory;
        private BigDecimal totalExclTax;
        private BigDecimal vatAmount = BigDecimal.ZERO;
        private BigDecimal vatRate;
        private boolean vatExemption;
        private BigDecimal taxDueInFrance;
        private boolean vatOnDebits;
        private String countryCode;
        private String currency = Invoice.DEFAULT_CURRENCY;

        private Builder() {
        }

        public Builder transactionId(String transactionId) {
            this.transactionId = transactionId;
            return this;
        }

        public Builder sellerSiren(String sellerSiren) {
            this.sellerSiren = sellerSiren;
            return this;
        }

        public Builder transactionType(EReportingTransactionType transactionType) {
            this.transactionType = transactionType;
            return this;
        }

        public Builder period(LocalDate start, LocalDate end) {
            this.periodStart = start;
            this.periodEnd = end;
            return this;
        }

        public Builder invoiceDate(LocalDate invoiceDate) {
            this.invoiceDate = invoiceDate;
            return this;
        }

        public Builder invoiceNumber(String invoiceNumber) {
            this.invoiceNumber = invoiceNumber;
            return this;
        }

        public Builder operationCategory(OperationCategory operationCategory) {
            this.operationCategory = operationCategory;
            return this;
        }

        public Builder totalExclTax(BigDecimal totalExclTax) {
            this.totalExclTax = totalExclTax;
            return this;
        }

        public Builder vatAmount(BigDecimal vatAmount) {
            this.vatAmount = vatAmount != null ? vatAmount : BigDecimal.ZERO;
            return this;
        }

        public Builder vatRate(BigDecimal vatRate) {
            this.vatRate = vatRate;
            return this;
        }

        public Builder vatExemption(boolean vatExemption) {
            this.vatExemption = vatExemption;
            return this;
        }

        public Builder taxDueInFrance(BigDecimal taxDueInFrance) {
            this.taxDueInFrance = taxDueInFrance;
            return this;
        }

        public Builder vatOnDebits(boolean vatOnDebits) {
            this.vatOnDebits = vatOnDebits;
            return this;
        }

        public Builder countryCode(String countryCode) {
            this.countryCode = countryCode;
            return this;
        }

        public Builder currency(String currency) {
            this.currency = currency != null ? currency : Invoice.DEFAULT_CURRENCY;
            return this;
        }

        public EReportingTransaction build() {
            return new EReportingTransaction(this);
        }
    }
}

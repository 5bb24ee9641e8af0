package com.example.einvoice.domain;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * A billed line.
 *
 * Quantity and unit price may be negative (returns, corrections). The net
 * amount is kept exact; rounding happens once per VAT group in
 * {@link com.example.einvoice.service.TaxCalculationService}.
 *
 * Sub-lines are informative detail (EXTENDED profile) and never contribute to totals.
 */
public final class InvoiceLine {

    public static final BigDecimal DEFAULT_VAT_RATE = new BigDecimal("20.0");

    private final Integer lineNumber;
    private final String description;
    private final BigDecimal quantity;
    private final UnitOfMeasure unit;
    private final BigDecimal unitPrice;
    private final BigDecimal vatRate;
    private final VatCategory vatCategory;
    private final String sellerItemReference;
    private final String buyerItemReference;
    private final BigDecimal discountAmount;
    private final BigDecimal chargeAmount;
    private final String exemptionReason;
    private final String exemptionReasonCode;
    private final LocalDate billingPeriodStart;
    private final LocalDate billingPeriodEnd;
    private final List<InvoiceLine> subLines;

    private InvoiceLine(Builder builder) {
        if (builder.lineNumber != null && builder.lineNumber <= 0) {
            throw new IllegalArgumentException("Line number must be positive: " + builder.lineNumber);
        }
        if (builder.description == null || builder.description.isBlank()) {
            throw new IllegalArgumentException("Line description is required");
        }
        if (builder.quantity == null) {
            throw new IllegalArgumentException("Line quantity is required");
        }
        if (builder.unitPrice == null) {
            throw new IllegalArgumentException("Line unit price is required");
        }
        if (builder.vatRate.signum() < 0) {
            throw new IllegalArgumentException("VAT rate cannot be negative: " + builder.vatRate);
        }
        if (builder.discountAmount != null && builder.discountAmount.signum() < 0) {
            throw new IllegalArgumentException("Discount amount cannot be negative");
        }
        if (builder.chargeAmount != null && builder.chargeAmount.signum() < 0) {
            throw new IllegalArgumentException("Charge amount cannot be negative");
        }
        if (builder.vatCategory.isReverseCharge()) {
            if (builder.vatRate.signum() != 0) {
                throw new IllegalArgumentException(
                    "Reverse charge line must have a VAT rate of 0, got " + builder.vatRate);
            }
            if (builder.exemptionReasonCode == null || builder.exemptionReasonCode.isBlank()) {
                throw new IllegalArgumentException(
                    "Reverse charge line requires an exemption reason code (e.g. VATEX-EU-AE)");
            }
        }
        if (builder.billingPeriodStart != null && builder.billingPeriodEnd != null
                && builder.billingPeriodStart.isAfter(builder.billingPeriodEnd)) {
            throw new IllegalArgumentException("Line billing period starts after it ends");
        }
        this.lineNumber = builder.lineNumber;
        this.description = builder.description;
        this.quantity = builder.quantity;
        this.unit = builder.unit;
        this.unitPrice = builder.unitPrice;
        this.vatRate = builder.vatRate;
        this.vatCategory = builder.vatCategory;
        this.sellerItemReference = builder.sellerItemReference;
        this.buyerItemReference = builder.buyerItemReference;
        this.discountAmount = builder.discountAmount;
        this.chargeAmount = builder.chargeAmount;
        this.exemptionReason = builder.exemptionReason;
        this.exemptionReasonCode = builder.exemptionReasonCode;
        this.billingPeriodStart = builder.billingPeriodStart;
        this.billingPeriodEnd = builder.billingPeriodEnd;
        this.subLines = List.copyOf(builder.subLines);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Exact net amount: quantity x unit price - discount + charge.
     */
    public BigDecimal getNetAmount() {
        BigDecimal net = quantity.multiply(unitPrice);
        if (discountAmount != null) {
            net = net.subtract(discountAmount);
        }
        if (chargeAmount != null) {
            net = net.add(chargeAmount);
        }
        return net;
    }

    public boolean hasBillingPeriod() {
        return billingPeriodStart != null || billingPeriodEnd != null;
    }

    public Integer getLineNumber() {
        return lineNumber;
    }

    public String getDescription() {
        return description;
    }

    public BigDecimal getQuantity() {
        return quantity;
    }

    public UnitOfMeasure getUnit() {
        return unit;
    }

    public BigDecimal getUnitPrice() {
        return unitPrice;
    }

    public BigDecimal getVatRate() {
        return vatRate;
    }

    public VatCategory getVatCategory() {
        return vatCategory;
    }

    public String getSellerItemReference() {
        return sellerItemReference;
    }

    public String getBuyerItemReference() {
        return buyerItemReference;
    }

    public BigDecimal getDiscountAmount() {
        return discountAmount;
    }

    public BigDecimal getChargeAmount() {
        return chargeAmount;
    }

    public String getExemptionReason() {
        return exemptionReason;
    }

    public String getExemptionReasonCode() {
        return exemptionReasonCode;
    }

    public LocalDate getBillingPeriodStart() {
        return billingPeriodStart;
    }

    public LocalDate getBillingPeriodEnd() {
        return billingPeriodEnd;
    }

    public List<InvoiceLine> getSubLines() {
        return subLines;
    }

    public static final class Builder {
        private Integer lineNumber;
        private String description;
        private BigDecimal quantity;
        private UnitOfMeasure unit = UnitOfMeasure.PIECE;
        private BigDecimal unitPrice;
        private BigDecimal vatRate = DEFAULT_VAT_RATE;
        private VatCategory vatCategory = VatCategory.STANDARD;
        private String sellerItemReference;
        private String buyerItemReference;
        private BigDecimal discountAmount;
        private BigDecimal chargeAmount;
        private String exemptionReason;
        private String exemptionReasonCode;
        private LocalDate billingPeriodStart;
        private LocalDate billingPeriodEnd;
        private final List<InvoiceLine> subLines = new ArrayList<>();

        private Builder() {
        }

        public Builder lineNumber(Integer lineNumber) {
            this.lineNumber = lineNumber;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder quantity(BigDecimal quantity) {
            this.quantity = quantity;
            return this;
        }

        public Builder quantity(String quantity) {
            return quantity(new BigDecimal(quantity));
        }

        public Builder unit(UnitOfMeasure unit) {
            this.unit = unit != null ? unit : UnitOfMeasure.PIECE;
            return this;
        }

        public Builder unitPrice(BigDecimal unitPrice) {
            this.unitPrice = unitPrice;
            return this;
        }

        public Builder unitPrice(String unitPrice) {
            return unitPrice(new BigDecimal(unitPrice));
        }

        public Builder vatRate(BigDecimal vatRate) {
            this.vatRate = vatRate != null ? vatRate : DEFAULT_VAT_RATE;
            return this;
        }

        public Builder vatRate(String vatRate) {
            return vatRate(new BigDecimal(vatRate));
        }

        public Builder vatCategory(VatCategory vatCategory) {
            this.vatCategory = vatCategory != null ? vatCategory : VatCategory.STANDARD;
            return this;
        }

        public Builder sellerItemReference(String sellerItemReference) {
            this.sellerItemReference = sellerItemReference;
            return this;
        }

        public Builder buyerItemReference(String buyerItemReference) {
            this.buyerItemReference = buyerItemReference;
            return this;
        }

        public Builder discountAmount(BigDecimal discountAmount) {
            this.discountAmount = discountAmount;
            return this;
        }

        public Builder chargeAmount(BigDecimal chargeAmount) {
            this.chargeAmount = chargeAmount;
            return this;
        }

        public Builder exemption(String reason, String reasonCode) {
            this.exemptionReason = reason;
            this.exemptionReasonCode = reasonCode;
            return this;
        }

        public Builder billingPeriod(LocalDate start, LocalDate end) {
            this.billingPeriodStart = start;
            this.billingPeriodEnd = end;
            return this;
        }

        public Builder addSubLine(InvoiceLine subLine) {
            this.subLines.add(subLine);
            return this;
        }

        public InvoiceLine build() {
            return new InvoiceLine(this);
        }
    }
}

package com.example.einvoice.domain;

/**
 * VAT category codes (UNTDID 5305).
 */
public enum VatCategory {
    STANDARD("S"),          // Standard or reduced rate
    ZERO_RATED("Z"),
    EXEMPT("E"),
    REVERSE_CHARGE("AE"),   // Autoliquidation
    INTRA_COMMUNITY("K"),   // Intra-EU supply
    EXPORT("G"),            // Export outside the EU
    OUTSIDE_SCOPE("O"),
    CANARY_ISLANDS("L"),
    CEUTA_MELILLA("M");

    private final String code;

    VatCategory(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public boolean isReverseCharge() {
        return this == REVERSE_CHARGE;
    }

    public static VatCategory fromCode(String code) {
        for (VatCategory category : values()) {
            if (category.code.equals(code)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown VAT category code: " + code);
    }
}

package com.example.einvoice.domain;

/**
 * Units of measure (UN/ECE Recommendation 20).
 */
public enum UnitOfMeasure {
    PIECE("C62"),
    HOUR("HUR"),
    DAY("DAY"),
    MONTH("MON"),
    YEAR("ANN"),
    KILOGRAM("KGM"),
    METRE("MTR"),
    SQUARE_METRE("MTK"),
    LITRE("LTR"),
    PACKAGE("XPP"),
    SET("SET"),
    PAIR("PR");

    private final String code;

    UnitOfMeasure(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}

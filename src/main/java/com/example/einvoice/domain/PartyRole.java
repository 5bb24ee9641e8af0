package com.example.einvoice.domain;

/**
 * Role codes of the actors exchanging lifecycle messages.
 */
public enum PartyRole {
    BUYER("BY"),
    SELLER("SE"),
    DELIVERY_PARTY("DL"),
    PLATFORM("WK"),
    TAX_ADMINISTRATION("DFH");

    private final String code;

    PartyRole(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static PartyRole fromCode(String code) {
        for (PartyRole role : values()) {
            if (role.code.equals(code)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown party role code: " + code);
    }
}

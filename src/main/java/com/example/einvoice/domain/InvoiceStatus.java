package com.example.einvoice.domain;

/**
 * Lifecycle statuses defined by AFNOR XP Z12-012.
 *
 * Each status carries its numeric code, whether it must be reported to the
 * tax administration, the actor that normally produces it and whether a
 * reason is mandatory when entering it.
 */
public enum InvoiceStatus {
    DEPOSITED(200, StatusCategory.MANDATORY, PartyRole.PLATFORM),
    EMITTED(201, StatusCategory.RECOMMENDED, PartyRole.PLATFORM),
    RECEIVED(202, StatusCategory.RECOMMENDED, PartyRole.PLATFORM),
    MADE_AVAILABLE(203, StatusCategory.RECOMMENDED, PartyRole.PLATFORM),
    TAKEN_IN_CHARGE(204, StatusCategory.RECOMMENDED, PartyRole.BUYER),
    APPROVED(205, StatusCategory.RECOMMENDED, PartyRole.BUYER),
    PARTIALLY_APPROVED(206, StatusCategory.RECOMMENDED, PartyRole.BUYER),
    DISPUTED(207, StatusCategory.RECOMMENDED, PartyRole.BUYER),
    SUSPENDED(208, StatusCategory.RECOMMENDED, PartyRole.BUYER),
    REJECTED_AT_EMISSION(209, StatusCategory.MANDATORY, PartyRole.PLATFORM),
    REFUSED(210, StatusCategory.MANDATORY, PartyRole.BUYER),
    PAYMENT_TRANSMITTED(211, StatusCategory.RECOMMENDED, PartyRole.BUYER),
    REJECTED_AT_RECEPTION(212, StatusCategory.MANDATORY, PartyRole.PLATFORM),
    COLLECTED(213, StatusCategory.MANDATORY, PartyRole.SELLER),
    COMPLETED(214, StatusCategory.RECOMMENDED, PartyRole.SELLER);

    private final int code;
    private final StatusCategory category;
    private final PartyRole defaultProducer;

    InvoiceStatus(int code, StatusCategory category, PartyRole defaultProducer) {
        this.code = code;
        this.category = category;
        this.defaultProducer = defaultProducer;
    }

    public int getCode() {
        return code;
    }

    public StatusCategory getCategory() {
        return category;
    }

    public PartyRole getDefaultProducer() {
        return defaultProducer;
    }

    public boolean isMandatory() {
        return category == StatusCategory.MANDATORY;
    }

    /** Only a refusal must be justified. */
    public boolean isReasonRequired() {
        return this == REFUSED;
    }

    public static InvoiceStatus fromCode(int code) {
        for (InvoiceStatus status : values()) {
            if (status.code == code) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown lifecycle status code: " + code);
    }
}

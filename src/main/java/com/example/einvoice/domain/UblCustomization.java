package com.example.einvoice.domain;

/**
 * Customisations of the UBL syntax.
 */
public enum UblCustomization {
    EN16931("urn:cen.eu:en16931:2017", null),
    PEPPOL_BIS_3("urn:cen.eu:en16931:2017#compliant#urn:fdc:peppol.eu:2017:poacc:billing:3.0",
        "urn:fdc:peppol.eu:2017:poacc:billing:01:1.0");

    private final String customizationId;
    private final String profileId;

    UblCustomization(String customizationId, String profileId) {
        this.customizationId = customizationId;
        this.profileId = profileId;
    }

    public String getCustomizationId() {
        return customizationId;
    }

    /** Business process identifier, only set for network profiles. */
    public String getProfileId() {
        return profileId;
    }
}

package com.example.einvoice.domain;

/**
 * Factur-X / ZUGFeRD profiles, from least to most detailed.
 *
 * EN16931 is the floor accepted by the French reform; the lower profiles
 * produce structurally valid but incomplete documents.
 */
public enum FacturXProfile {
    MINIMUM("urn:factur-x.eu:1p0:minimum", "MINIMUM", "MINIMUM"),
    BASIC_WL("urn:factur-x.eu:1p0:basicwl", "BASICWL", "BASIC WL"),
    BASIC("urn:cen.eu:en16931:2017#compliant#urn:factur-x.eu:1p0:basic", "BASIC", "BASIC"),
    EN16931("urn:cen.eu:en16931:2017", "EN16931", "EN 16931"),
    EXTENDED("urn:cen.eu:en16931:2017#conformant#urn:factur-x.eu:1p0:extended", "EXTENDED", "EXTENDED");

    private final String guidelineId;
    private final String schemaName;
    private final String conformanceLevel;

    FacturXProfile(String guidelineId, String schemaName, String conformanceLevel) {
        this.guidelineId = guidelineId;
        this.schemaName = schemaName;
        this.conformanceLevel = conformanceLevel;
    }

    public String getGuidelineId() {
        return guidelineId;
    }

    /** Profile token used in the Factur-X XSD file names. */
    public String getSchemaName() {
        return schemaName;
    }

    /** Value of fx:ConformanceLevel in the PDF's XMP metadata. */
    public String getConformanceLevel() {
        return conformanceLevel;
    }

    public boolean isAtLeast(FacturXProfile other) {
        return compareTo(other) >= 0;
    }

    public boolean isRegulatoryCompliant() {
        return isAtLeast(EN16931);
    }

    public static FacturXProfile fromGuidelineId(String guidelineId) {
        for (FacturXProfile profile : values()) {
            if (profile.guidelineId.equals(guidelineId)) {
                return profile;
            }
        }
        throw new IllegalArgumentException("Unknown Factur-X guideline ID: " + guidelineId);
    }

    /**
     * Resolves a profile by name, accepting both "BASIC_WL" and "BASICWL".
     */
    public static FacturXProfile fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Profile name is required");
        }
        String normalized = name.trim().toUpperCase();
        for (FacturXProfile profile : values()) {
            if (profile.name().equals(normalized) || profile.schemaName.equals(normalized)) {
                return profile;
            }
        }
        throw new IllegalArgumentException("Unknown profile: " + name);
    }
}

package com.example.einvoice.domain;

/**
 * Nature of the operations billed, mandatory on every invoice from September 2026.
 * The label is written verbatim in the invoice note with subject code AAI.
 */
public enum OperationCategory {
    DELIVERY("Livraison de biens"),
    SERVICE("Prestation de services"),
    MIXED("Livraison de biens et prestation de services");

    private final String label;

    OperationCategory(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}

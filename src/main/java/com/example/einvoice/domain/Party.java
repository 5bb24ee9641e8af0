package com.example.einvoice.domain;

import java.util.regex.Pattern;

/**
 * Seller, buyer or payee of an invoice.
 *
 * The SIREN identifies the legal unit (9 digits); the SIRET identifies an
 * establishment (SIREN + 5 digits).
 */
public final class Party {

    private static final Pattern SIREN_PATTERN = Pattern.compile("\\d{9}");
    private static final Pattern SIRET_PATTERN = Pattern.compile("\\d{14}");

    private final String name;
    private final String siren;
    private final String siret;
    private final String vatNumber;
    private final String legalRegistrationId;
    private final Address address;
    private final Address deliveryAddress;
    private final String email;
    private final String phone;

    private Party(Builder builder) {
        if (builder.name == null || builder.name.isBlank()) {
            throw new IllegalArgumentException("Party name is required");
        }
        if (builder.address == null) {
            throw new IllegalArgumentException("Party address is required for " + builder.name);
        }
        if (builder.siren != null && !isValidSiren(builder.siren)) {
            throw new IllegalArgumentException("Invalid SIREN (9 digits expected): " + builder.siren);
        }
        if (builder.siret != null && !SIRET_PATTERN.matcher(builder.siret).matches()) {
            throw new IllegalArgumentException("Invalid SIRET (14 digits expected): " + builder.siret);
        }
        this.name = builder.name;
        this.siren = builder.siren;
        this.siret = builder.siret;
        this.vatNumber = builder.vatNumber;
        this.legalRegistrationId = builder.legalRegistrationId;
        this.address = builder.address;
        this.deliveryAddress = builder.deliveryAddress;
        this.email = builder.email;
        this.phone = builder.phone;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static boolean isValidSiren(String siren) {
        return siren != null && SIREN_PATTERN.matcher(siren).matches();
    }

    public String getName() {
        return name;
    }

    public String getSiren() {
        return siren;
    }

    public String getSiret() {
        return siret;
    }

    public String getVatNumber() {
        return vatNumber;
    }

    public String getLegalRegistrationId() {
        return legalRegistrationId;
    }

    public Address getAddress() {
        return address;
    }

    public Address getDeliveryAddress() {
        return deliveryAddress;
    }

    public String getEmail() {
        return email;
    }

    public String getPhone() {
        return phone;
    }

    @Override
    public String toString() {
        return name + (siren != null ? " (" + siren + ")" : "");
    }

    public static final class Builder {
        private String name;
        private String siren;
        private String siret;
        private String vatNumber;
        private String legalRegistrationId;
        private Address address;
        private Address deliveryAddress;
        private String email;
        private String phone;

        private Builder() {
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder siren(String siren) {
            this.siren = siren;
            return this;
        }

        public Builder siret(String siret) {
            this.siret = siret;
            return this;
        }

        public Builder vatNumber(String vatNumber) {
            this.vatNumber = vatNumber;
            return this;
        }

        public Builder legalRegistrationId(String legalRegistrationId) {
            this.legalRegistrationId = legalRegistrationId;
            return this;
        }

        public Builder address(Address address) {
            this.address = address;
            return this;
        }

        public Builder deliveryAddress(Address deliveryAddress) {
            this.deliveryAddress = deliveryAddress;
            return this;
        }

        public Builder email(String email) {
            this.email = email;
            return this;
        }

        public Builder phone(String phone) {
            this.phone = phone;
            return this;
        }

        public Party build() {
            return new Party(this);
        }
    }
}

package com.example.einvoice.domain;

/**
 * Postal address of a party.
 *
 * @param countryCode ISO 3166-1 alpha-2 code, FR when omitted
 */
public record Address(
    String street,
    String additionalStreet,
    String city,
    String postalCode,
    String countryCode,
    String subdivision
) {

    public Address {
        if (street == null || street.isBlank()) {
            throw new IllegalArgumentException("Address street is required");
        }
        if (city == null || city.isBlank()) {
            throw new IllegalArgumentException("Address city is required");
        }
        if (postalCode == null || postalCode.isBlank()) {
            throw new IllegalArgumentException("Address postal code is required");
        }
        if (countryCode == null) {
            countryCode = "FR";
        }
        if (!countryCode.matches("[A-Z]{2}")) {
            throw new IllegalArgumentException("Invalid ISO 3166-1 country code: " + countryCode);
        }
    }

    public Address(String street, String city, String postalCode) {
        this(street, null, city, postalCode, "FR", null);
    }

    public Address(String street, String city, String postalCode, String countryCode) {
        this(street, null, city, postalCode, countryCode, null);
    }
}

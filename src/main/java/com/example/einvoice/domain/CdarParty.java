package com.example.einvoice.domain;

/**
 * Actor named in a lifecycle message.
 *
 * @param schemeId identification scheme: 0002 SIREN, 0009 SIRET, 0224 routing code, 0088 GLN
 */
public record CdarParty(String identifier, String schemeId, PartyRole role) {

    public CdarParty {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("Party identifier is required");
        }
        if (role == null) {
            throw new IllegalArgumentException("Party role is required");
        }
    }

    public static CdarParty siren(String siren, PartyRole role) {
        return new CdarParty(siren, "0002", role);
    }
}

package com.address.resolution.domain.model;

/**
 * Field groups requested from a place details lookup.
 */
public enum PlaceDetailsField {
    COMPONENTS("address_components"),
    GEOMETRY("geometry"),
    FORMATTED_ADDRESS("formatted_address");

    private final String providerName;

    PlaceDetailsField(String providerName) {
        this.providerName = providerName;
    }

    public String getProviderName() {
        return providerName;
    }
}

package com.address.resolution.domain.model;

/**
 * Result type filters for a narrowed reverse geocode.
 */
public enum ResultType {
    POSTAL_CODE("postal_code");

    private final String providerName;

    ResultType(String providerName) {
        this.providerName = providerName;
    }

    public String getProviderName() {
        return providerName;
    }
}

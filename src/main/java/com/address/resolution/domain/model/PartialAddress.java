package com.address.resolution.domain.model;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Structured view of a component list before city/state and street rules are applied.
 * Every field is {@code null} when the provider did not supply it; empty strings are never stored.
 */
@Getter
@Builder
@EqualsAndHashCode
@ToString
public class PartialAddress {
    private final String streetNumber;
    private final String route;
    private final String sublocality;
    private final String locality;
    private final String adminArea1;
    private final String country;
    private final String postalCode;

    public static PartialAddress empty() {
        return PartialAddress.builder().build();
    }

    public boolean hasStreetNumber() {
        return streetNumber != null;
    }

    public boolean hasRoute() {
        return route != null;
    }

    public boolean hasLocality() {
        return locality != null;
    }

    public boolean hasPostalCode() {
        return postalCode != null;
    }
}

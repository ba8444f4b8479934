package com.address.resolution.domain.model;

import com.address.resolution.domain.service.CoordinateValidator;
import com.address.resolution.domain.service.PlusCodes;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.EnumSet;
import java.util.Set;

/**
 * Canonical address record produced by every resolution flow.
 *
 * Invariants enforced on construction:
 * - text fields are never null; an empty string means "not resolved"
 * - the street address never starts with a Plus Code (such a value becomes empty)
 * - latitude and longitude are either both present and in range, or both absent
 */
@Getter
@EqualsAndHashCode
@ToString
public class ResolvedAddress {

    private static final ResolvedAddress EMPTY = ResolvedAddress.builder().build();

    private final String streetAddress;
    private final String city;
    private final String state;
    private final String postalCode;
    private final Double latitude;
    private final Double longitude;

    @Builder
    private ResolvedAddress(
            String streetAddress,
            String city,
            String state,
            String postalCode,
            Double latitude,
            Double longitude) {
        String street = streetAddress == null ? "" : streetAddress.trim();
        this.streetAddress = PlusCodes.isPlusCode(street) ? "" : street;
        this.city = city == null ? "" : city;
        this.state = state == null ? "" : state;
        this.postalCode = postalCode == null ? "" : postalCode;

        if (CoordinateValidator.validate(latitude, longitude)) {
            this.latitude = latitude;
            this.longitude = longitude;
        } else {
            this.latitude = null;
            this.longitude = null;
        }
    }

    /**
     * Record with every field empty or absent; returned for failed resolutions.
     */
    public static ResolvedAddress empty() {
        return EMPTY;
    }

    public boolean hasCoordinates() {
        return latitude != null;
    }

    /**
     * Fields a caller may want to prompt the user for.
     */
    public Set<AddressField> missingFields() {
        Set<AddressField> missing = EnumSet.noneOf(AddressField.class);
        if (streetAddress.isEmpty()) {
            missing.add(AddressField.STREET_ADDRESS);
        }
        if (city.isEmpty()) {
            missing.add(AddressField.CITY);
        }
        if (state.isEmpty()) {
            missing.add(AddressField.STATE);
        }
        if (postalCode.isEmpty()) {
            missing.add(AddressField.POSTAL_CODE);
        }
        if (!hasCoordinates()) {
            missing.add(AddressField.COORDINATES);
        }
        return missing;
    }

    public boolean isEmpty() {
        return missingFields().size() == AddressField.values().length;
    }
}

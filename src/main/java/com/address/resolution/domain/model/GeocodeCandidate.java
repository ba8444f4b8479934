package com.address.resolution.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * One raw result of a provider query (place details, reverse geocode or forward geocode).
 * Held only while a resolution call is selecting and mapping.
 */
@Getter
@EqualsAndHashCode
@ToString
public class GeocodeCandidate {
    private final String placeId;
    private final String formattedAddress;
    private final List<RawAddressComponent> components;
    private final GeoPoint location;

    public GeocodeCandidate(
            String placeId,
            String formattedAddress,
            List<RawAddressComponent> components,
            GeoPoint location) {
        this.placeId = placeId;
        this.formattedAddress = formattedAddress == null ? "" : formattedAddress;
        this.components = components == null ? List.of() : List.copyOf(components);
        this.location = location;
    }

    public GeocodeCandidate(String formattedAddress, List<RawAddressComponent> components, GeoPoint location) {
        this(null, formattedAddress, components, location);
    }
}

package com.address.resolution.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Value object representing a latitude/longitude pair in decimal degrees.
 * Range checks are the job of {@link com.address.resolution.domain.service.CoordinateValidator};
 * a point read from a provider may be out of range and is rejected there.
 */
@Getter
@EqualsAndHashCode
@ToString
public class GeoPoint {
    private final double lat;
    private final double lng;

    public GeoPoint(double lat, double lng) {
        this.lat = lat;
        this.lng = lng;
    }
}

package com.address.resolution.domain.service;

import com.address.resolution.domain.model.GeoPoint;

/**
 * Range check applied to every coordinate pair before it is accepted into a record.
 *
 * Rule: both values finite, latitude in [-90, 90], longitude in [-180, 180].
 * A pair failing the check is treated as absent by callers, never kept partially.
 */
public final class CoordinateValidator {

    public static final double MAX_LATITUDE = 90.0d;
    public static final double MAX_LONGITUDE = 180.0d;

    private CoordinateValidator() {
        // Utility class
    }

    public static boolean validate(double lat, double lng) {
        if (!Double.isFinite(lat) || !Double.isFinite(lng)) {
            return false;
        }
        return lat >= -MAX_LATITUDE && lat <= MAX_LATITUDE
            && lng >= -MAX_LONGITUDE && lng <= MAX_LONGITUDE;
    }

    /**
     * Boxed variant; a missing value fails validation.
     */
    public static boolean validate(Double lat, Double lng) {
        return lat != null && lng != null && validate(lat.doubleValue(), lng.doubleValue());
    }

    public static boolean validate(GeoPoint point) {
        return point != null && validate(point.getLat(), point.getLng());
    }
}

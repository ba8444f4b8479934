package com.address.resolution.domain.model;

/**
 * Provider taxonomy labels used by the engine.
 */
public final class ComponentTag {

    public static final String STREET_NUMBER = "street_number";
    public static final String ROUTE = "route";
    public static final String SUBLOCALITY = "sublocality";
    public static final String SUBLOCALITY_LEVEL_1 = "sublocality_level_1";
    public static final String LOCALITY = "locality";
    public static final String ADMIN_AREA_LEVEL_1 = "administrative_area_level_1";
    public static final String COUNTRY = "country";
    public static final String POSTAL_CODE = "postal_code";

    private ComponentTag() {
        // Constants only
    }
}

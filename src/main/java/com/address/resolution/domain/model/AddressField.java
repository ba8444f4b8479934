package com.address.resolution.domain.model;

/**
 * Fields of a {@link ResolvedAddress}, used to report which ones are still unresolved.
 */
public enum AddressField {
    STREET_ADDRESS,
    CITY,
    STATE,
    POSTAL_CODE,
    COORDINATES
}

package com.address.resolution.domain.service;

import com.address.resolution.domain.model.CityState;
import com.address.resolution.domain.model.ComponentTag;
import com.address.resolution.domain.model.PartialAddress;
import com.address.resolution.domain.model.RawAddressComponent;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Domain service turning provider address components into structured address fields.
 *
 * Mapping Rule: one pass in provider order, first non-blank value wins per slot.
 * Providers already list components most-specific-first, so nothing is re-sorted.
 * The sublocality slot is shared by {@code sublocality} and {@code sublocality_level_1}
 * and keeps the last value written to it.
 *
 * City/State Rule:
 * - locality present: city = locality, state = admin area level 1, else country
 * - otherwise: city = admin area level 1, else sublocality; state = country
 */
@Service
public class ComponentTaxonomyMapper {

    /**
     * Maps a component list to a partial address.
     *
     * @param components Provider components in provider order, may be null
     * @return Partial address with absent slots left null
     */
    public PartialAddress map(List<RawAddressComponent> components) {
        String streetNumber = null;
        String route = null;
        String sublocality = null;
        String locality = null;
        String adminArea1 = null;
        String country = null;
        String postalCode = null;

        if (components == null) {
            return PartialAddress.empty();
        }

        for (RawAddressComponent component : components) {
            String value = component.getLongValue().trim();
            if (value.isEmpty()) {
                continue;
            }

            if (streetNumber == null && component.hasTag(ComponentTag.STREET_NUMBER)) {
                streetNumber = value;
            }
            if (route == null && component.hasTag(ComponentTag.ROUTE)) {
                route = value;
            }
            if (component.hasTag(ComponentTag.SUBLOCALITY) || component.hasTag(ComponentTag.SUBLOCALITY_LEVEL_1)) {
                sublocality = value;
            }
            if (locality == null && component.hasTag(ComponentTag.LOCALITY)) {
                locality = value;
            }
            if (adminArea1 == null && component.hasTag(ComponentTag.ADMIN_AREA_LEVEL_1)) {
                adminArea1 = value;
            }
            if (country == null && component.hasTag(ComponentTag.COUNTRY)) {
                country = value;
            }
            if (postalCode == null && component.hasTag(ComponentTag.POSTAL_CODE)) {
                postalCode = value;
            }
        }

        return PartialAddress.builder()
            .streetNumber(streetNumber)
            .route(route)
            .sublocality(sublocality)
            .locality(locality)
            .adminArea1(adminArea1)
            .country(country)
            .postalCode(postalCode)
            .build();
    }

    /**
     * Applies the city/state rule to a mapped address.
     * Both rules live here so a record never mixes them.
     */
    public CityState resolveCityState(PartialAddress partial) {
        if (partial.hasLocality()) {
            return new CityState(
                partial.getLocality(),
                firstPresent(partial.getAdminArea1(), partial.getCountry()));
        }
        return new CityState(
            firstPresent(partial.getAdminArea1(), partial.getSublocality()),
            partial.getCountry());
    }

    /**
     * Builds the street line: "number route", then route alone, then the first readable
     * segment of the formatted address with any leading Plus Code dropped.
     *
     * @param partial Mapped components
     * @param fallbackFormattedAddress Provider formatted address, may be null
     * @return Street line, empty string when nothing usable exists
     */
    public String resolveStreet(PartialAddress partial, String fallbackFormattedAddress) {
        if (partial.hasStreetNumber() && partial.hasRoute()) {
            return partial.getStreetNumber() + " " + partial.getRoute();
        }
        if (partial.hasRoute()) {
            return partial.getRoute();
        }
        return PlusCodes.firstReadableSegment(fallbackFormattedAddress);
    }

    /**
     * Postal code carried by a component list, or null.
     */
    public String findPostalCode(List<RawAddressComponent> components) {
        if (components == null) {
            return null;
        }
        for (RawAddressComponent component : components) {
            if (component.hasTag(ComponentTag.POSTAL_CODE) && !component.getLongValue().isBlank()) {
                return component.getLongValue().trim();
            }
        }
        return null;
    }

    private static String firstPresent(String first, String second) {
        return first != null ? first : second;
    }
}

package com.address.resolution.domain.service;

import com.address.resolution.domain.model.CityState;
import com.address.resolution.domain.model.ComponentTag;
import com.address.resolution.domain.model.PartialAddress;
import com.address.resolution.domain.model.RawAddressComponent;
import com.address.resolution.module.test.support.TestFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.address.resolution.module.test.support.TestFixtures.Addresses;
import static com.address.resolution.module.test.support.TestFixtures.component;
import static org.assertj.core.api.Assertions.assertThat;

class ComponentTaxonomyMapperTest {

    private final ComponentTaxonomyMapper mapper = new ComponentTaxonomyMapper();

    @Test
    void testMap_FullComponents_FillsEverySlot() {
        PartialAddress partial = mapper.map(TestFixtures.springfieldComponents());

        assertThat(partial.getStreetNumber()).isEqualTo("123");
        assertThat(partial.getRoute()).isEqualTo("Main St");
        assertThat(partial.getLocality()).isEqualTo("Springfield");
        assertThat(partial.getAdminArea1()).isEqualTo("IL");
        assertThat(partial.getCountry()).isEqualTo("United States");
        assertThat(partial.getPostalCode()).isEqualTo("62704");
        assertThat(partial.getSublocality()).isNull();
    }

    @Test
    void testMap_DuplicateTags_FirstValueWins() {
        PartialAddress partial = mapper.map(List.of(
                component("Springfield", ComponentTag.LOCALITY),
                component("Chatham", ComponentTag.LOCALITY),
                component("62704", ComponentTag.POSTAL_CODE),
                component("62707", ComponentTag.POSTAL_CODE)));

        assertThat(partial.getLocality()).isEqualTo("Springfield");
        assertThat(partial.getPostalCode()).isEqualTo("62704");
    }

    @Test
    void testMap_SublocalityTags_LastValueWins() {
        PartialAddress partial = mapper.map(List.of(
                component("Brooklyn", ComponentTag.SUBLOCALITY),
                component("Williamsburg", ComponentTag.SUBLOCALITY_LEVEL_1)));

        assertThat(partial.getSublocality()).isEqualTo("Williamsburg");
    }

    @Test
    void testMap_BlankValues_AreIgnored() {
        PartialAddress partial = mapper.map(List.of(
                component("  ", ComponentTag.ROUTE),
                component("Oak Ave", ComponentTag.ROUTE)));

        assertThat(partial.getRoute()).isEqualTo("Oak Ave");
    }

    @Test
    void testMap_NullOrEmpty_ReturnsEmptyPartial() {
        assertThat(mapper.map(null)).isEqualTo(PartialAddress.empty());
        assertThat(mapper.map(List.of())).isEqualTo(PartialAddress.empty());
    }

    @Test
    void testResolveCityState_WithLocality_UsesAdminAreaAsState() {
        CityState cityState = mapper.resolveCityState(mapper.map(TestFixtures.springfieldComponents()));

        assertThat(cityState.getCity()).isEqualTo("Springfield");
        assertThat(cityState.getState()).isEqualTo("IL");
    }

    @Test
    void testResolveCityState_WithLocalityNoAdminArea_FallsBackToCountry() {
        CityState cityState = mapper.resolveCityState(mapper.map(List.of(
                component("Singapore", ComponentTag.LOCALITY),
                component("Singapore", ComponentTag.COUNTRY))));

        assertThat(cityState.getCity()).isEqualTo("Singapore");
        assertThat(cityState.getState()).isEqualTo("Singapore");
    }

    @Test
    void testResolveCityState_NoLocality_UsesAdminAreaAsCityAndCountryAsState() {
        CityState cityState = mapper.resolveCityState(mapper.map(List.of(
                component("Tokyo", ComponentTag.ADMIN_AREA_LEVEL_1),
                component("Japan", ComponentTag.COUNTRY))));

        assertThat(cityState.getCity()).isEqualTo("Tokyo");
        assertThat(cityState.getState()).isEqualTo("Japan");
    }

    @Test
    void testResolveCityState_OnlySublocality_UsesSublocalityAsCity() {
        CityState cityState = mapper.resolveCityState(mapper.map(List.of(
                component("Brooklyn", ComponentTag.SUBLOCALITY_LEVEL_1),
                component("United States", ComponentTag.COUNTRY))));

        assertThat(cityState.getCity()).isEqualTo("Brooklyn");
        assertThat(cityState.getState()).isEqualTo("United States");
    }

    @Test
    void testResolveCityState_NothingMapped_ReturnsEmptyStrings() {
        CityState cityState = mapper.resolveCityState(PartialAddress.empty());

        assertThat(cityState.getCity()).isEmpty();
        assertThat(cityState.getState()).isEmpty();
    }

    @Test
    void testResolveStreet_NumberAndRoute_JoinsWithSpace() {
        PartialAddress partial = mapper.map(TestFixtures.springfieldComponents());

        assertThat(mapper.resolveStreet(partial, Addresses.SPRINGFIELD)).isEqualTo("123 Main St");
    }

    @Test
    void testResolveStreet_RouteOnly_ReturnsRoute() {
        PartialAddress partial = PartialAddress.builder().route("Main St").build();

        assertThat(mapper.resolveStreet(partial, Addresses.SPRINGFIELD)).isEqualTo("Main St");
    }

    @Test
    void testResolveStreet_NumberWithoutRoute_UsesFormattedAddress() {
        PartialAddress partial = PartialAddress.builder().streetNumber("123").build();

        assertThat(mapper.resolveStreet(partial, "Route 66 Diner, Springfield")).isEqualTo("Route 66 Diner");
    }

    @Test
    void testResolveStreet_PlusCodeFormattedAddress_SkipsPlusCodeSegment() {
        assertThat(mapper.resolveStreet(PartialAddress.empty(), Addresses.PLUS_CODE_SPRINGFIELD))
                .isEqualTo("Springfield");
    }

    @Test
    void testResolveStreet_NothingUsable_ReturnsEmpty() {
        assertThat(mapper.resolveStreet(PartialAddress.empty(), null)).isEmpty();
        assertThat(mapper.resolveStreet(PartialAddress.empty(), "8GXX+PH")).isEmpty();
    }

    @Test
    void testFindPostalCode_ReturnsFirstPostalCodeOrNull() {
        List<RawAddressComponent> components = List.of(
                component("Springfield", ComponentTag.LOCALITY),
                component("62704", ComponentTag.POSTAL_CODE));

        assertThat(mapper.findPostalCode(components)).isEqualTo("62704");
        assertThat(mapper.findPostalCode(List.of(component("Springfield", ComponentTag.LOCALITY)))).isNull();
        assertThat(mapper.findPostalCode(null)).isNull();
    }
}

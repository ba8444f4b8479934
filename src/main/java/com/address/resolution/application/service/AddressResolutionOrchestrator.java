package com.address.resolution.application.service;

import com.address.resolution.application.dto.ResolutionResult;
import com.address.resolution.application.port.in.ResolveAddressUseCase;
import com.address.resolution.application.port.out.GeocodingProvider;
import com.address.resolution.application.port.out.GeocodingProviderException;
import com.address.resolution.domain.model.CityState;
import com.address.resolution.domain.model.GeoPoint;
import com.address.resolution.domain.model.GeocodeCandidate;
import com.address.resolution.domain.model.PartialAddress;
import com.address.resolution.domain.model.PlaceDetailsField;
import com.address.resolution.domain.model.ResolvedAddress;
import com.address.resolution.domain.service.CandidateSelector;
import com.address.resolution.domain.service.ComponentTaxonomyMapper;
import com.address.resolution.domain.service.CoordinateValidator;
import com.address.resolution.domain.service.PlusCodes;
import com.address.resolution.domain.service.StoredLocationDecoder;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Application service resolving canonical addresses from provider results.
 *
 * Flows:
 * - Selection: place details → map components → street fallback to prediction text
 * - Coordinates: validate → reverse geocode → select candidate → map → backfill postal code
 * - Query: forward geocode → first match's coordinates → same pipeline as coordinates
 * - Stored point: decode [lng, lat] → coordinates flow
 *
 * The service keeps no state between calls apart from the staleness sequence numbers.
 */
@Service
public class AddressResolutionOrchestrator implements ResolveAddressUseCase {

    private static final Logger logger = LoggerFactory.getLogger(AddressResolutionOrchestrator.class);

    private static final Set<PlaceDetailsField> DETAIL_FIELDS =
        Collections.unmodifiableSet(EnumSet.allOf(PlaceDetailsField.class));

    private final GeocodingProvider geocodingProvider;
    private final ComponentTaxonomyMapper componentTaxonomyMapper;
    private final CandidateSelector candidateSelector;
    private final PostalCodeBackfiller postalCodeBackfiller;
    private final StoredLocationDecoder storedLocationDecoder;
    private final StalenessGuard stalenessGuard;

    public AddressResolutionOrchestrator(
            GeocodingProvider geocodingProvider,
            ComponentTaxonomyMapper componentTaxonomyMapper,
            CandidateSelector candidateSelector,
            PostalCodeBackfiller postalCodeBackfiller,
            StoredLocationDecoder storedLocationDecoder,
            StalenessGuard stalenessGuard) {
        this.geocodingProvider = geocodingProvider;
        this.componentTaxonomyMapper = componentTaxonomyMapper;
        this.candidateSelector = candidateSelector;
        this.postalCodeBackfiller = postalCodeBackfiller;
        this.storedLocationDecoder = storedLocationDecoder;
        this.stalenessGuard = stalenessGuard;
    }

    @Override
    public Mono<ResolutionResult> resolveFromSelection(String callSite, String placeId, String predictionDescription) {
        StalenessGuard.Ticket ticket = stalenessGuard.issue(callSite, StalenessGuard.Flow.SELECTION);

        if (placeId == null || placeId.isBlank()) {
            return stalenessGuard.guard(ticket, Mono.just(ResolutionResult.validationError("Place id is required")));
        }

        logger.debug("Resolving selection: placeId={}, description='{}', ticket={}",
            placeId, predictionDescription, ticket);

        Mono<ResolutionResult> result = Mono.defer(() -> geocodingProvider.getPlaceDetails(placeId, DETAIL_FIELDS))
            .map(details -> {
                ResolvedAddress address = fromPlaceDetails(details, predictionDescription);
                logger.info("Resolved selection {} -> {}", placeId, address);
                return ResolutionResult.resolved(address);
            })
            .switchIfEmpty(Mono.fromSupplier(() -> ResolutionResult.notFound("No details for place " + placeId)))
            .onErrorResume(GeocodingProviderException.class, e -> providerFailure("place details", e));

        return stalenessGuard.guard(ticket, result);
    }

    @Override
    public Mono<ResolutionResult> resolveFromCoordinates(String callSite, double lat, double lng) {
        StalenessGuard.Ticket ticket = stalenessGuard.issue(callSite, StalenessGuard.Flow.COORDINATES);

        if (!CoordinateValidator.validate(lat, lng)) {
            logger.debug("Rejecting coordinates outside valid range: lat={}, lng={}", lat, lng);
            return stalenessGuard.guard(ticket, Mono.just(ResolutionResult.validationError(
                "Coordinates out of range: lat=" + lat + ", lng=" + lng)));
        }

        GeoPoint point = new GeoPoint(lat, lng);
        logger.debug("Resolving coordinates: {}, ticket={}", point, ticket);

        Mono<ResolutionResult> result = Mono.defer(() -> geocodingProvider.reverseGeocode(lat, lng))
            .defaultIfEmpty(List.of())
            .flatMap(candidates -> annotate(point, candidates))
            .onErrorResume(GeocodingProviderException.class, e -> providerFailure("reverse geocode", e));

        return stalenessGuard.guard(ticket, result);
    }

    @Override
    public Mono<ResolutionResult> resolveFromQuery(String callSite, String queryText) {
        StalenessGuard.Ticket ticket = stalenessGuard.issue(callSite, StalenessGuard.Flow.QUERY);

        if (queryText == null || queryText.isBlank()) {
            return stalenessGuard.guard(ticket, Mono.just(
                ResolutionResult.validationError("Please enter an address to search")));
        }

        String query = queryText.trim();
        logger.debug("Resolving query: '{}', ticket={}", query, ticket);

        Mono<ResolutionResult> result = Mono.defer(() -> geocodingProvider.geocode(query))
            .defaultIfEmpty(List.of())
            .flatMap(candidates -> {
                if (candidates.isEmpty()) {
                    return Mono.just(ResolutionResult.notFound("Location not found for '" + query + "'"));
                }
                GeoPoint location = candidates.get(0).getLocation();
                if (!CoordinateValidator.validate(location)) {
                    logger.warn("Best match for '{}' has no usable geometry: {}", query, location);
                    return Mono.just(ResolutionResult.notFound("Location not found for '" + query + "'"));
                }
                return annotate(location, candidates);
            })
            .onErrorResume(GeocodingProviderException.class, e -> providerFailure("geocode", e));

        return stalenessGuard.guard(ticket, result);
    }

    @Override
    public Mono<ResolutionResult> resolveFromStoredPoint(String callSite, JsonNode storedPoint) {
        Optional<GeoPoint> point = storedLocationDecoder.decode(storedPoint);

        if (point.isEmpty()) {
            StalenessGuard.Ticket ticket = stalenessGuard.issue(callSite, StalenessGuard.Flow.COORDINATES);
            return stalenessGuard.guard(ticket, Mono.just(
                ResolutionResult.validationError("Stored location is not a valid [lng, lat] point")));
        }

        return resolveFromCoordinates(callSite, point.get().getLat(), point.get().getLng());
    }

    /**
     * Build the record for a place details response.
     * The prediction text the user picked is the last street fallback.
     */
    private ResolvedAddress fromPlaceDetails(GeocodeCandidate details, String predictionDescription) {
        PartialAddress partial = componentTaxonomyMapper.map(details.getComponents());
        CityState cityState = componentTaxonomyMapper.resolveCityState(partial);

        String street = componentTaxonomyMapper.resolveStreet(partial, details.getFormattedAddress());
        if (street.isEmpty() || PlusCodes.isPlusCode(street)) {
            street = PlusCodes.leadingSegment(predictionDescription);
        }

        GeoPoint location = details.getLocation();
        if (location != null && !CoordinateValidator.validate(location)) {
            logger.warn("Discarding out-of-range place geometry {}", location);
        }

        return ResolvedAddress.builder()
            .streetAddress(street)
            .city(cityState.getCity())
            .state(cityState.getState())
            .postalCode(partial.getPostalCode())
            .latitude(location == null ? null : location.getLat())
            .longitude(location == null ? null : location.getLng())
            .build();
    }

    /**
     * Select, map and backfill a candidate list for known coordinates.
     * The record keeps the given coordinates rather than the provider's.
     */
    private Mono<ResolutionResult> annotate(GeoPoint point, List<GeocodeCandidate> candidates) {
        if (candidates.isEmpty()) {
            logger.info("No address found at {}", point);
            return Mono.just(ResolutionResult.notFound("No address found at " + point.getLat() + ", " + point.getLng()));
        }

        GeocodeCandidate selected = candidateSelector.select(candidates);
        PartialAddress partial = componentTaxonomyMapper.map(selected.getComponents());
        CityState cityState = componentTaxonomyMapper.resolveCityState(partial);
        String street = componentTaxonomyMapper.resolveStreet(partial, selected.getFormattedAddress());

        logger.debug("Selected candidate '{}' of {} at {}", selected.getFormattedAddress(), candidates.size(), point);

        return postalCodeBackfiller.backfill(partial, point, candidates)
            .map(postalCode -> {
                ResolvedAddress address = ResolvedAddress.builder()
                    .streetAddress(street)
                    .city(cityState.getCity())
                    .state(cityState.getState())
                    .postalCode(postalCode)
                    .latitude(point.getLat())
                    .longitude(point.getLng())
                    .build();
                logger.info("Resolved {} -> {}", point, address);
                return ResolutionResult.resolved(address);
            });
    }

    private Mono<ResolutionResult> providerFailure(String operation, GeocodingProviderException e) {
        logger.error("Geocoding provider failed during {}: {} ({})", operation, e.getMessage(), e.getReason());
        return Mono.just(ResolutionResult.providerError(e));
    }
}

package com.address.resolution.application.service;

import com.address.resolution.application.port.out.GeocodingProvider;
import com.address.resolution.application.port.out.GeocodingProviderException;
import com.address.resolution.domain.model.GeoPoint;
import com.address.resolution.domain.model.GeocodeCandidate;
import com.address.resolution.domain.model.PartialAddress;
import com.address.resolution.domain.model.ResultType;
import com.address.resolution.domain.service.ComponentTaxonomyMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Fills in a missing postal code after a reverse geocode.
 *
 * Search order, each step only when the previous found nothing:
 * 1. the selected candidate's own postal code
 * 2. the first postal code in any candidate of the same response
 * 3. one extra reverse geocode narrowed to postal code results
 *
 * Backfill is best effort: a provider failure in step 3 yields an empty postal code.
 */
@Service
public class PostalCodeBackfiller {

    private static final Logger logger = LoggerFactory.getLogger(PostalCodeBackfiller.class);

    private final GeocodingProvider geocodingProvider;
    private final ComponentTaxonomyMapper componentTaxonomyMapper;

    public PostalCodeBackfiller(
            GeocodingProvider geocodingProvider,
            ComponentTaxonomyMapper componentTaxonomyMapper) {
        this.geocodingProvider = geocodingProvider;
        this.componentTaxonomyMapper = componentTaxonomyMapper;
    }

    /**
     * @param primary Mapped selected candidate
     * @param coordinates Coordinates of the primary query
     * @param allCandidates Every candidate of the primary query
     * @return Postal code, or empty string when none could be found
     */
    public Mono<String> backfill(PartialAddress primary, GeoPoint coordinates, List<GeocodeCandidate> allCandidates) {
        if (primary.hasPostalCode()) {
            return Mono.just(primary.getPostalCode());
        }

        for (GeocodeCandidate candidate : allCandidates) {
            String postalCode = componentTaxonomyMapper.findPostalCode(candidate.getComponents());
            if (postalCode != null) {
                logger.debug("Postal code {} taken from sibling candidate '{}'",
                    postalCode, candidate.getFormattedAddress());
                return Mono.just(postalCode);
            }
        }

        logger.debug("No postal code among {} candidates, querying postal code results at {}",
            allCandidates.size(), coordinates);

        return Mono.defer(() -> geocodingProvider.reverseGeocode(
                coordinates.getLat(), coordinates.getLng(), ResultType.POSTAL_CODE))
            .map(this::postalCodeOfFirst)
            .defaultIfEmpty("")
            .onErrorResume(GeocodingProviderException.class, e -> {
                logger.warn("Postal code backfill failed at {}, continuing without postal code: {} ({})",
                    coordinates, e.getMessage(), e.getReason());
                return Mono.just("");
            });
    }

    private String postalCodeOfFirst(List<GeocodeCandidate> results) {
        if (results.isEmpty()) {
            return "";
        }
        String postalCode = componentTaxonomyMapper.findPostalCode(results.get(0).getComponents());
        return postalCode == null ? "" : postalCode;
    }
}

package com.address.resolution.application.port.out;

import com.address.resolution.domain.model.GeocodeCandidate;
import com.address.resolution.domain.model.PlaceDetailsField;
import com.address.resolution.domain.model.PlacePrediction;
import com.address.resolution.domain.model.ResultType;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Set;

/**
 * Output port for the geocoding provider (mapping API client).
 *
 * Every operation is non-blocking. Failures, including the adapter's own timeout,
 * are signalled as {@link GeocodingProviderException}.
 */
public interface GeocodingProvider {

  /**
   * Autocomplete predictions for user-typed text, restricted to geocodable results.
   */
  Mono<List<PlacePrediction>> getPlacePredictions(String queryText);

  /**
   * Place details for a prediction's place id.
   * A place the provider does not know fails with reason NOT_FOUND.
   */
  Mono<GeocodeCandidate> getPlaceDetails(String placeId, Set<PlaceDetailsField> fields);

  /**
   * Reverse geocode, most relevant candidate first. No match yields an empty list.
   */
  Mono<List<GeocodeCandidate>> reverseGeocode(double lat, double lng);

  /**
   * Reverse geocode narrowed to a single result type.
   */
  Mono<List<GeocodeCandidate>> reverseGeocode(double lat, double lng, ResultType resultType);

  /**
   * Forward geocode of free text. No match yields an empty list.
   */
  Mono<List<GeocodeCandidate>> geocode(String queryText);
}

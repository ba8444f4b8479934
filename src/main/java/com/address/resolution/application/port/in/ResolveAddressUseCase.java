package com.address.resolution.application.port.in;

import com.address.resolution.application.dto.ResolutionResult;
import com.fasterxml.jackson.databind.JsonNode;
import reactor.core.publisher.Mono;

/**
 * Input port for turning a user's selection, a map position or typed text into a canonical address.
 *
 * Staleness: calls are sequenced per call site and flow. When a newer call has been issued
 * for the same call site and flow before an older one completes, the older call's Mono
 * completes empty instead of emitting.
 */
public interface ResolveAddressUseCase {

  String DEFAULT_CALL_SITE = "default";

  /**
   * Resolve a selected autocomplete prediction via place details.
   *
   * @param callSite Identity of the calling form or picker
   * @param placeId Prediction place id
   * @param predictionDescription Text the user picked; its first segment is the street fallback
   * @return Resolution result, or empty if superseded
   */
  Mono<ResolutionResult> resolveFromSelection(String callSite, String placeId, String predictionDescription);

  /**
   * Annotate known coordinates (map click, current location) with address text.
   * The returned coordinates are the input, not the provider's.
   */
  Mono<ResolutionResult> resolveFromCoordinates(String callSite, double lat, double lng);

  /**
   * Search free text and resolve the best match, coordinates included.
   */
  Mono<ResolutionResult> resolveFromQuery(String callSite, String queryText);

  /**
   * Resolve a stored {@code [lng, lat]} or GeoJSON point, e.g. when a picker opens prefilled.
   */
  Mono<ResolutionResult> resolveFromStoredPoint(String callSite, JsonNode storedPoint);

  default Mono<ResolutionResult> resolveFromSelection(String placeId, String predictionDescription) {
    return resolveFromSelection(DEFAULT_CALL_SITE, placeId, predictionDescription);
  }

  default Mono<ResolutionResult> resolveFromCoordinates(double lat, double lng) {
    return resolveFromCoordinates(DEFAULT_CALL_SITE, lat, lng);
  }

  default Mono<ResolutionResult> resolveFromQuery(String queryText) {
    return resolveFromQuery(DEFAULT_CALL_SITE, queryText);
  }
}

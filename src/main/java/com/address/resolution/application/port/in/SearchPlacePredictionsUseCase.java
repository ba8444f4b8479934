package com.address.resolution.application.port.in;

import com.address.resolution.domain.model.PlacePrediction;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Input port for address autocomplete.
 * Debouncing keystrokes is the caller's job; superseded searches complete empty.
 */
public interface SearchPlacePredictionsUseCase {

  /**
   * @param callSite Identity of the calling input
   * @param queryText Text typed so far
   * @return Predictions, empty list for short input or provider failure, empty Mono if superseded
   */
  Mono<List<PlacePrediction>> searchPredictions(String callSite, String queryText);

  default Mono<List<PlacePrediction>> searchPredictions(String queryText) {
    return searchPredictions(ResolveAddressUseCase.DEFAULT_CALL_SITE, queryText);
  }
}

package com.address.resolution.application.service;

import com.address.resolution.application.port.in.SearchPlacePredictionsUseCase;
import com.address.resolution.application.port.out.GeocodingProvider;
import com.address.resolution.application.port.out.GeocodingProviderException;
import com.address.resolution.domain.model.PlacePrediction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Application service for address autocomplete predictions.
 * Predictions are advisory: provider failures produce an empty list, not an error.
 */
@Service
public class PlacePredictionService implements SearchPlacePredictionsUseCase {

    private static final Logger logger = LoggerFactory.getLogger(PlacePredictionService.class);

    /**
     * Shorter input is not worth a provider round trip.
     */
    public static final int MIN_QUERY_LENGTH = 2;

    private final GeocodingProvider geocodingProvider;
    private final StalenessGuard stalenessGuard;

    public PlacePredictionService(GeocodingProvider geocodingProvider, StalenessGuard stalenessGuard) {
        this.geocodingProvider = geocodingProvider;
        this.stalenessGuard = stalenessGuard;
    }

    @Override
    public Mono<List<PlacePrediction>> searchPredictions(String callSite, String queryText) {
        StalenessGuard.Ticket ticket = stalenessGuard.issue(callSite, StalenessGuard.Flow.PREDICTIONS);

        String query = queryText == null ? "" : queryText.trim();
        if (query.length() < MIN_QUERY_LENGTH) {
            return stalenessGuard.guard(ticket, Mono.just(List.of()));
        }

        Mono<List<PlacePrediction>> result = Mono.defer(() -> geocodingProvider.getPlacePredictions(query))
            .defaultIfEmpty(List.of())
            .doOnNext(predictions -> logger.debug("{} predictions for '{}'", predictions.size(), query))
            .onErrorResume(GeocodingProviderException.class, e -> {
                logger.warn("Prediction search failed for '{}': {} ({})", query, e.getMessage(), e.getReason());
                return Mono.just(List.of());
            });

        return stalenessGuard.guard(ticket, result);
    }
}

package com.address.resolution.infrastructure.external;

import com.address.resolution.application.port.out.GeocodingProvider;
import com.address.resolution.application.port.out.GeocodingProviderException;
import com.address.resolution.application.port.out.GeocodingProviderException.Reason;
import com.address.resolution.domain.model.GeoPoint;
import com.address.resolution.domain.model.GeocodeCandidate;
import com.address.resolution.domain.model.PlaceDetailsField;
import com.address.resolution.domain.model.PlacePrediction;
import com.address.resolution.domain.model.RawAddressComponent;
import com.address.resolution.domain.model.ResultType;
import com.address.resolution.infrastructure.cache.GeocodeResponseCache;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Client for the Google Geocoding and Places web services.
 * Handles request building, HTTP calls, status mapping and response parsing.
 */
@Service
public class GoogleGeocodingClient implements GeocodingProvider {

    private static final Logger logger = LoggerFactory.getLogger(GoogleGeocodingClient.class);

    static final String GEOCODE_PATH = "/maps/api/geocode/json";
    static final String PLACE_DETAILS_PATH = "/maps/api/place/details/json";
    static final String PLACE_AUTOCOMPLETE_PATH = "/maps/api/place/autocomplete/json";

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final GeocodeResponseCache responseCache;
    private final String apiKey;
    private final String language;
    private final int timeoutSeconds;

    public GoogleGeocodingClient(
        WebClient.Builder webClientBuilder,
        ObjectMapper objectMapper,
        GeocodeResponseCache responseCache,
        @Value("${app.geocoding.base-url:https://maps.googleapis.com}") String baseUrl,
        @Value("${app.geocoding.api-key:}") String apiKey,
        @Value("${app.geocoding.language:}") String language,
        @Value("${app.geocoding.timeout-seconds:10}") int timeoutSeconds
    ) {
        this.objectMapper = objectMapper;
        this.responseCache = responseCache;
        this.apiKey = apiKey;
        this.language = language;
        this.timeoutSeconds = timeoutSeconds;
        this.webClient = webClientBuilder
            .baseUrl(baseUrl)
            .build();

        if (apiKey == null || apiKey.isBlank()) {
            logger.warn("No geocoding API key configured (app.geocoding.api-key); provider will deny requests");
        }
    }

    @Override
    public Mono<List<PlacePrediction>> getPlacePredictions(String queryText) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("input", queryText);
        params.put("types", "geocode");
        return get(PLACE_AUTOCOMPLETE_PATH, params).map(this::parsePredictions);
    }

    @Override
    public Mono<GeocodeCandidate> getPlaceDetails(String placeId, Set<PlaceDetailsField> fields) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("place_id", placeId);
        params.put("fields", fields.stream()
            .map(PlaceDetailsField::getProviderName)
            .sorted()
            .collect(Collectors.joining(",")));
        return get(PLACE_DETAILS_PATH, params).map(root -> {
            JsonNode result = root.get("result");
            if (result == null || !result.isObject()) {
                throw new GeocodingProviderException(Reason.NOT_FOUND, "No place details for " + placeId);
            }
            return parseCandidate(result);
        });
    }

    @Override
    public Mono<List<GeocodeCandidate>> reverseGeocode(double lat, double lng) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("latlng", formatLatLng(lat, lng));
        return get(GEOCODE_PATH, params).map(this::parseResults);
    }

    @Override
    public Mono<List<GeocodeCandidate>> reverseGeocode(double lat, double lng, ResultType resultType) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("latlng", formatLatLng(lat, lng));
        params.put("result_type", resultType.getProviderName());
        return get(GEOCODE_PATH, params).map(this::parseResults);
    }

    @Override
    public Mono<List<GeocodeCandidate>> geocode(String queryText) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("address", queryText);
        return get(GEOCODE_PATH, params).map(this::parseResults);
    }

    /**
     * Execute a GET against the provider, serving repeated requests from the response cache.
     * Only responses with a usable status are cached.
     */
    private Mono<JsonNode> get(String path, Map<String, String> params) {
        if (language != null && !language.isBlank()) {
            params.put("language", language);
        }
        String cacheKey = buildCacheKey(path, params);

        Optional<String> cached = responseCache.get(cacheKey);
        if (cached.isPresent()) {
            return Mono.fromCallable(() -> readChecked(cached.get(), path));
        }

        Map<String, String> uriVariables = new LinkedHashMap<>(params);
        uriVariables.put("key", apiKey == null ? "" : apiKey);

        logger.debug("Executing provider request: {}", cacheKey);

        return webClient.get()
            .uri(uriBuilder -> {
                uriBuilder.path(path);
                uriVariables.keySet().forEach(name -> uriBuilder.queryParam(name, "{" + name + "}"));
                return uriBuilder.build(uriVariables);
            })
            .retrieve()
            .bodyToMono(String.class)
            .timeout(Duration.ofSeconds(timeoutSeconds))
            .retryWhen(Retry.fixedDelay(2, Duration.ofSeconds(1))
                .filter(throwable -> throwable instanceof WebClientRequestException))
            .onErrorMap(throwable -> !(throwable instanceof GeocodingProviderException), this::toProviderException)
            .map(body -> {
                JsonNode root = readChecked(body, path);
                responseCache.put(cacheKey, body);
                return root;
            });
    }

    /**
     * Parse a response body and fail on any provider status other than OK / ZERO_RESULTS.
     */
    private JsonNode readChecked(String body, String path) {
        JsonNode root;
        try {
            root = body == null ? null : objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            logger.error("Failed to parse provider response from {}", path, e);
            throw new GeocodingProviderException(Reason.MALFORMED_RESPONSE, "Unparsable provider response", e);
        }
        if (root == null || !root.isObject()) {
            throw new GeocodingProviderException(Reason.MALFORMED_RESPONSE, "Empty provider response from " + path);
        }

        String status = root.path("status").asText("");
        String detail = root.path("error_message").asText(status);
        switch (status) {
            case "OK", "ZERO_RESULTS" -> {
                return root;
            }
            case "OVER_QUERY_LIMIT", "OVER_DAILY_LIMIT", "REQUEST_DENIED" -> {
                logger.error("Provider refused request to {}: {} - {}", path, status, detail);
                throw new GeocodingProviderException(Reason.QUOTA, "Provider returned " + status + ": " + detail);
            }
            case "NOT_FOUND", "INVALID_REQUEST" ->
                throw new GeocodingProviderException(Reason.NOT_FOUND, "Provider returned " + status + ": " + detail);
            case "UNKNOWN_ERROR" ->
                throw new GeocodingProviderException(Reason.NETWORK, "Provider returned " + status + ": " + detail);
            default -> {
                logger.warn("Unknown provider status '{}' from {}", status, path);
                throw new GeocodingProviderException(Reason.MALFORMED_RESPONSE, "Unexpected provider status: " + status);
            }
        }
    }

    private GeocodingProviderException toProviderException(Throwable throwable) {
        Throwable cause = Exceptions.isRetryExhausted(throwable) && throwable.getCause() != null
            ? throwable.getCause()
            : throwable;

        if (cause instanceof WebClientResponseException e) {
            logger.error("Provider returned error: {} - {}", e.getStatusCode(), e.getResponseBodyAsString());
            int status = e.getStatusCode().value();
            if (status == HttpStatus.TOO_MANY_REQUESTS.value() || status == HttpStatus.FORBIDDEN.value()) {
                return new GeocodingProviderException(Reason.QUOTA, "Provider returned " + e.getStatusCode(), e);
            }
            if (status == HttpStatus.NOT_FOUND.value()) {
                return new GeocodingProviderException(Reason.NOT_FOUND, "Provider returned " + e.getStatusCode(), e);
            }
            return new GeocodingProviderException(Reason.NETWORK, "Provider returned " + e.getStatusCode(), e);
        }
        if (cause instanceof TimeoutException) {
            logger.error("Provider request timed out after {}s", timeoutSeconds);
            return new GeocodingProviderException(Reason.NETWORK, "Provider request timed out", cause);
        }
        if (cause instanceof WebClientRequestException) {
            logger.error("Failed to connect to geocoding provider", cause);
            return new GeocodingProviderException(Reason.NETWORK, "Failed to connect to geocoding provider", cause);
        }
        logger.error("Unexpected error querying geocoding provider", cause);
        return new GeocodingProviderException(Reason.NETWORK, "Unexpected error querying geocoding provider", cause);
    }

    private List<GeocodeCandidate> parseResults(JsonNode root) {
        JsonNode results = root.get("results");
        if (results == null || !results.isArray()) {
            if ("ZERO_RESULTS".equals(root.path("status").asText())) {
                return List.of();
            }
            throw new GeocodingProviderException(Reason.MALFORMED_RESPONSE, "Provider response missing results array");
        }

        List<GeocodeCandidate> candidates = new ArrayList<>();
        for (JsonNode result : results) {
            try {
                candidates.add(parseCandidate(result));
            } catch (RuntimeException e) {
                logger.warn("Failed to parse geocode result: {}", result, e);
            }
        }

        logger.debug("Parsed {} candidates from provider response", candidates.size());
        return candidates;
    }

    /**
     * Parse a single geocode or place details result into a candidate.
     */
    private GeocodeCandidate parseCandidate(JsonNode result) {
        List<RawAddressComponent> components = new ArrayList<>();
        for (JsonNode component : result.path("address_components")) {
            List<String> tags = new ArrayList<>();
            component.path("types").forEach(type -> tags.add(type.asText()));
            components.add(new RawAddressComponent(
                tags,
                textOrNull(component.get("long_name")),
                textOrNull(component.get("short_name"))));
        }

        GeoPoint location = null;
        JsonNode point = result.path("geometry").path("location");
        if (point.path("lat").isNumber() && point.path("lng").isNumber()) {
            location = new GeoPoint(point.get("lat").asDouble(), point.get("lng").asDouble());
        }

        return new GeocodeCandidate(
            textOrNull(result.get("place_id")),
            textOrNull(result.get("formatted_address")),
            components,
            location);
    }

    private List<PlacePrediction> parsePredictions(JsonNode root) {
        List<PlacePrediction> predictions = new ArrayList<>();
        for (JsonNode prediction : root.path("predictions")) {
            try {
                JsonNode formatting = prediction.path("structured_formatting");
                predictions.add(new PlacePrediction(
                    textOrNull(prediction.get("place_id")),
                    textOrNull(prediction.get("description")),
                    textOrNull(formatting.get("main_text")),
                    textOrNull(formatting.get("secondary_text"))));
            } catch (IllegalArgumentException e) {
                logger.warn("Skipping prediction without place id: {}", prediction);
            }
        }
        return predictions;
    }

    /**
     * Plain decimal notation; {@code Double.toString} switches to exponents below 1e-3.
     */
    static String formatLatLng(double lat, double lng) {
        return plainDecimal(lat) + "," + plainDecimal(lng);
    }

    private static String plainDecimal(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private static String buildCacheKey(String path, Map<String, String> params) {
        return path + "?" + new TreeMap<>(params).entrySet().stream()
            .map(entry -> entry.getKey() + "=" + entry.getValue())
            .collect(Collectors.joining("&"));
    }

    private static String textOrNull(JsonNode node) {
        return (node != null && !node.isMissingNode() && !node.isNull()) ? node.asText() : null;
    }
}

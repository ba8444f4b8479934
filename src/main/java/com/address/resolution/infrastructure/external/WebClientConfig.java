package com.address.resolution.infrastructure.external;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * WebClient configuration for the geocoding provider.
 *
 * Responses are read as strings and parsed with Jackson in the client, so only the
 * in-memory buffer limit needs raising for large reverse geocode responses.
 */
@Configuration
public class WebClientConfig {

    @Bean
    public WebClient.Builder webClientBuilder(
        @Value("${app.geocoding.max-response-bytes:1048576}") int maxResponseBytes
    ) {
        return WebClient.builder()
            .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
            .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(maxResponseBytes));
    }
}

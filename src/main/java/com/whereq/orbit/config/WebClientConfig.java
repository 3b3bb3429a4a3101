package com.whereq.orbit.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * WebClient shared by the HTTP placement backends. Each backend clones it and sets its
 * own adapter base URL.
 */
@Configuration
public class WebClientConfig {

    /**
     * Instance lists of large clusters can exceed the 256KB default buffer
     */
    private static final int MAX_RESPONSE_BYTES = 4 * 1024 * 1024;

    @Bean
    public WebClient.Builder placementWebClientBuilder() {
        return WebClient.builder()
            .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
            .codecs(configurer -> configurer
                .defaultCodecs()
                .maxInMemorySize(MAX_RESPONSE_BYTES));
    }
}
